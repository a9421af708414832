package com.codescout.core.navigation;

public record TextMatch(String file, int line, String content) {
}
