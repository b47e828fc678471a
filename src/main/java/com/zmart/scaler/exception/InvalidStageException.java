package com.zmart.scaler.exception;

/**
 * Raised when a stage cannot be appended: non-positive investment, leverage or entry price,
 * the maximum stage count is reached, or the position is no longer accumulating.
 */
public class InvalidStageException extends EngineException {

    public InvalidStageException(String message) {
        super(message);
    }
}
