package com.zmart.scaler.winrate;

public enum WinRateDirection {
    LONG,
    SHORT,
    NEUTRAL
}
