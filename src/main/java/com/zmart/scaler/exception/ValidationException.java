package com.zmart.scaler.exception;

/**
 * Raised when an input value is outside its allowed range.
 */
public class ValidationException extends EngineException {

    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    /**
     * Name of the offending input field, e.g. {@code long_win_rate}.
     */
    public String getField() {
        return field;
    }
}
