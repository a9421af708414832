package com.codescout.core.review;

import com.codescout.core.CodescoutException;

public class InvalidProjectRootException extends CodescoutException {

    public InvalidProjectRootException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "invalid_project_root";
    }
}
