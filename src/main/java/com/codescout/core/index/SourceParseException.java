package com.codescout.core.index;

import com.codescout.core.CodescoutException;

public class SourceParseException extends CodescoutException {

    public SourceParseException(String message) {
        super(message);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "parse_failure";
    }
}
