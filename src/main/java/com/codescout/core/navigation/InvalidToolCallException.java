package com.codescout.core.navigation;

import com.codescout.core.CodescoutException;

/**
 * The engine asked for an unknown operation or passed malformed arguments.
 */
public class InvalidToolCallException extends CodescoutException {

    public InvalidToolCallException(String message) {
        super(message);
    }

    public InvalidToolCallException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "invalid_call";
    }
}
