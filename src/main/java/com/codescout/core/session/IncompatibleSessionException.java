package com.codescout.core.session;

import com.codescout.core.CodescoutException;

/**
 * A stored session record uses a format version this build cannot read.
 */
public class IncompatibleSessionException extends CodescoutException {

    public IncompatibleSessionException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "incompatible_session";
    }
}
