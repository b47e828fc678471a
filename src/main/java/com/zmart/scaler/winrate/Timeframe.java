package com.zmart.scaler.winrate;

import java.math.BigDecimal;

/**
 * Analysis horizons, with their weight in the overall confidence.
 */
public enum Timeframe {

    SHORT_TERM("24h", "Short-term", "24-hour analysis for day trading", new BigDecimal("0.40")),
    MEDIUM_TERM("7d", "Medium-term", "7-day analysis for swing trading", new BigDecimal("0.35")),
    LONG_TERM("1m", "Long-term", "1-month analysis for position trading", new BigDecimal("0.25"));

    private final String code;
    private final String displayName;
    private final String description;
    private final BigDecimal weight;

    Timeframe(String code, String displayName, String description, BigDecimal weight) {
        this.code = code;
        this.displayName = displayName;
        this.description = description;
        this.weight = weight;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getWeight() {
        return weight;
    }

    /**
     * Look up by code ("24h", "7d", "1m").
     */
    public static Timeframe fromCode(String code) {
        for (Timeframe timeframe : values()) {
            if (timeframe.code.equalsIgnoreCase(code)) {
                return timeframe;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe code: " + code);
    }
}
