package com.codescout.core.review;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReviewError(@JsonProperty("kind") String kind, @JsonProperty("message") String message) {
}
