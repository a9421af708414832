package com.codescout.core.session;

import com.codescout.core.CodescoutException;

public class SessionExistsException extends CodescoutException {

    public SessionExistsException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "session_exists";
    }
}
