package com.relcore.exception;

/**
 * Thrown by a parser when query text is not syntactically valid.
 */
public class ParseException extends RuntimeException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
