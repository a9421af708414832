package com.codescout.core.index;

public enum ParseStatus {
    /** Source file scanned successfully. */
    PARSED,
    /** Source file that could not be decoded or scanned. */
    FAILED,
    /** Source file above the size ceiling; listed but not scanned. */
    TOO_LARGE,
    /** Not a recognised source language. */
    NOT_SOURCE
}
