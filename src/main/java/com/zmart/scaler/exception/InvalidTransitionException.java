package com.zmart.scaler.exception;

import com.zmart.scaler.position.PositionStatus;

public class InvalidTransitionException extends EngineException {

    private final PositionStatus currentStatus;

    public InvalidTransitionException(PositionStatus currentStatus, String message) {
        super("[" + currentStatus + "] " + message);
        this.currentStatus = currentStatus;
    }

    public PositionStatus getCurrentStatus() {
        return currentStatus;
    }
}
