package com.zmart.scaler.exception;

/**
 * Base type for every rejected engine operation.
 * A thrown engine exception always leaves the affected state unchanged.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
