package com.codescout.core.sandbox;

/**
 * A file exists but its bytes are not valid UTF-8 text.
 */
public class BinaryContentException extends NotFoundException {

    public BinaryContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
