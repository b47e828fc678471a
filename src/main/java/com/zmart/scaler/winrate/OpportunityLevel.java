package com.zmart.scaler.winrate;

import java.math.BigDecimal;

/**
 * Opportunity tiers derived from a win-rate score.
 * Each tier covers [threshold, next tier's threshold); declared from highest to lowest.
 */
public enum OpportunityLevel {

    EXCEPTIONAL("Exceptional", "95", "1.0", RiskLevel.LOW, "95-100%",
            "ALL IN - Exceptional opportunity",
            "All in trade - Exceptional opportunity with very high win rate"),

    INFREQUENT("Infrequent", "90", "0.7", RiskLevel.LOW, "90-94%",
            "HIGH CONFIDENCE - Enter with large position",
            "High confidence trade - Infrequent opportunity with excellent win rate"),

    GOOD("Good", "80", "0.4", RiskLevel.MEDIUM, "80-89%",
            "GOOD OPPORTUNITY - Enter trade",
            "Enter trade with confidence - Good opportunity with strong win rate"),

    MODERATE("Moderate", "70", "0.2", RiskLevel.MEDIUM, "70-79%",
            "MODERATE - Consider carefully",
            "Consider trade carefully - Moderate opportunity"),

    WEAK("Weak", "60", "0.1", RiskLevel.HIGH, "60-69%",
            "WEAK - Exercise caution",
            "Exercise caution - Weak opportunity"),

    AVOID("Avoid", "0", "0.0", RiskLevel.VERY_HIGH, "0-59%",
            "AVOID - Win rate too low",
            "Avoid trade - Win rate too low for profitable trading");

    private static final BigDecimal TRADEABLE = new BigDecimal("60");
    private static final BigDecimal HIGH_CONFIDENCE = new BigDecimal("90");
    private static final BigDecimal EXCEPTIONAL_RATE = new BigDecimal("95");

    private final String displayName;
    private final BigDecimal threshold;
    private final BigDecimal positionSize;
    private final RiskLevel riskLevel;
    private final String winRateRange;
    private final String action;
    private final String description;

    OpportunityLevel(String displayName, String threshold, String positionSize, RiskLevel riskLevel,
                     String winRateRange, String action, String description) {
        this.displayName = displayName;
        this.threshold = new BigDecimal(threshold);
        this.positionSize = new BigDecimal(positionSize);
        this.riskLevel = riskLevel;
        this.winRateRange = winRateRange;
        this.action = action;
        this.description = description;
    }

    /**
     * First tier whose threshold the score meets (inclusive lower bound).
     */
    public static OpportunityLevel classify(BigDecimal score) {
        for (OpportunityLevel level : values()) {
            if (score.compareTo(level.threshold) >= 0) {
                return level;
            }
        }
        return AVOID;
    }

    public static boolean isTradeable(BigDecimal winRate) {
        return winRate.compareTo(TRADEABLE) >= 0;
    }

    public static boolean isHighConfidence(BigDecimal winRate) {
        return winRate.compareTo(HIGH_CONFIDENCE) >= 0;
    }

    public static boolean isExceptional(BigDecimal winRate) {
        return winRate.compareTo(EXCEPTIONAL_RATE) >= 0;
    }

    /**
     * WEAK and AVOID turn an overall recommendation into HOLD.
     */
    public boolean collapsesToHold() {
        return this == WEAK || this == AVOID;
    }

    public String getDisplayName() {
        return displayName;
    }

    public BigDecimal getThreshold() {
        return threshold;
    }

    /**
     * Fraction of the allowed position size, 0.0 - 1.0.
     */
    public BigDecimal getPositionSize() {
        return positionSize;
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    public String getWinRateRange() {
        return winRateRange;
    }

    public String getAction() {
        return action;
    }

    public String getDescription() {
        return description;
    }
}
