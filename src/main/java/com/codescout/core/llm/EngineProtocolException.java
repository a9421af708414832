package com.codescout.core.llm;

import com.codescout.core.CodescoutException;

/**
 * The engine responded, but with an error status or an empty/unusable message.
 */
public class EngineProtocolException extends CodescoutException {

    public EngineProtocolException(String message) {
        super(message);
    }

    public EngineProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "engine_protocol_error";
    }
}
