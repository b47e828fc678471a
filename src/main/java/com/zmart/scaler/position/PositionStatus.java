package com.zmart.scaler.position;

/**
 * Lifecycle of a staged position.
 *
 * ACCUMULATING -> FIRST_TAKE -> TRAILING -> CLOSED, with CLOSED reachable from
 * any other status through an explicit close.
 */
public enum PositionStatus {

    /** Stages may still be appended. */
    ACCUMULATING,

    /** First partial take realized; passed through within the same tick. */
    FIRST_TAKE,

    /** Only the trailing stop is monitored. */
    TRAILING,

    /** Terminal. */
    CLOSED;

    public boolean isOpen() {
        return this != CLOSED;
    }
}
