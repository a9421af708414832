package com.codescout.core.review;

public enum ReviewState {
    INIT,
    SEEDED,
    EXPLORING,
    TERMINATED_NORMAL,
    TERMINATED_BOUND,
    TERMINATED_ERROR;

    public boolean isTerminal() {
        return this == TERMINATED_NORMAL || this == TERMINATED_BOUND || this == TERMINATED_ERROR;
    }
}
