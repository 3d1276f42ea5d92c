package com.relcore.exception;

/**
 * Thrown when a query fails analysis.
 *
 * <p>Raised for unresolved or ambiguous references, type errors and other
 * problems detected before a plan is optimized. Analysis failures are not
 * retried; the failure is memoized by the query execution that raised it.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
