package com.relcore.exception;

/**
 * Thrown when the configured SQL dialect has no registered parser.
 */
public class UnsupportedDialectException extends RuntimeException {

    private final String dialect;

    public UnsupportedDialectException(String dialect) {
        super("Unsupported SQL dialect: " + dialect);
        this.dialect = dialect;
    }

    public String dialect() {
        return dialect;
    }
}
