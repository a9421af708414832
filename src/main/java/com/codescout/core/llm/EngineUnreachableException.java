package com.codescout.core.llm;

import com.codescout.core.CodescoutException;

public class EngineUnreachableException extends CodescoutException {

    public EngineUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "engine_unreachable";
    }
}
