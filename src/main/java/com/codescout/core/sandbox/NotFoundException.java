package com.codescout.core.sandbox;

import com.codescout.core.CodescoutException;

public class NotFoundException extends CodescoutException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "not_found";
    }
}
