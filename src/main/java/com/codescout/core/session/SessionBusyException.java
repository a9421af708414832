package com.codescout.core.session;

import com.codescout.core.CodescoutException;

/**
 * Another review holds the lease on this session.
 */
public class SessionBusyException extends CodescoutException {

    public SessionBusyException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "session_busy";
    }
}
