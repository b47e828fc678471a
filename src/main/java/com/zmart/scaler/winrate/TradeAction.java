package com.zmart.scaler.winrate;

/**
 * Overall call handed to the decision layer.
 */
public enum TradeAction {
    LONG,
    SHORT,
    HOLD
}
