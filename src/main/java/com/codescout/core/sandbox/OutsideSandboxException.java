package com.codescout.core.sandbox;

import com.codescout.core.CodescoutException;

/**
 * Thrown when a requested path cannot be proven to stay inside the project root.
 */
public class OutsideSandboxException extends CodescoutException {

    public OutsideSandboxException(String message) {
        super(message);
    }

    public OutsideSandboxException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "outside_sandbox";
    }
}
