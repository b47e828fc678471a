package com.zmart.scaler.position;

/**
 * Side of a leveraged position.
 */
public enum PositionDirection {

    LONG,
    SHORT;

    /**
     * +1 for LONG, -1 for SHORT. Multiplies a price move into a profit sign.
     */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
