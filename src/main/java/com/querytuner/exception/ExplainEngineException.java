package com.querytuner.exception;

import lombok.Getter;

/**
 * The analytical engine rejected or failed a statement.
 *
 * <p>During a diagnostics batch this is turned into a per-result error string and never
 * aborts the batch.
 */
@Getter
public class ExplainEngineException extends RuntimeException {

    private final int statusCode;

    public ExplainEngineException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public ExplainEngineException(String message, Throwable cause) {
        this(message, -1, cause);
    }
}
