package com.zmart.scaler.config;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Tunable parameters of the scaling, take-profit and scoring components.
 * One instance is built by the caller and handed to each component's constructor.
 */
@Data
@Builder
public class EngineSettings {

    // Profit threshold as a fraction of total invested (0.75 = 75%)
    @Builder.Default
    private final BigDecimal profitFraction = new BigDecimal("0.75");

    @Builder.Default
    private final int maxStages = 4;

    // Take-profit splits, as fractions of total position value
    @Builder.Default
    private final BigDecimal firstTakeFraction = new BigDecimal("0.30");
    @Builder.Default
    private final BigDecimal secondTakeFraction = new BigDecimal("0.25");
    @Builder.Default
    private final BigDecimal finalTakeFraction = new BigDecimal("0.45");

    /**
     * Trailing stop distance armed after the first take.
     * 0.30 leaves a 30% giveback before the stop fires; kept configurable until confirmed.
     */
    @Builder.Default
    private final BigDecimal trailFraction = new BigDecimal("0.30");

    // Tight trailing stop armed after the second take (tiered mode only)
    @Builder.Default
    private final BigDecimal finalTrailFraction = new BigDecimal("0.03");

    @Builder.Default
    private final boolean tieredTakeProfit = false;

    // Max |long - short| win-rate difference still considered NEUTRAL
    @Builder.Default
    private final BigDecimal neutralThreshold = new BigDecimal("5.0");

    // Scaling advisor
    @Builder.Default
    private final BigDecimal betterScoreRatio = new BigDecimal("1.2");
    @Builder.Default
    private final BigDecimal liquidationBuffer = new BigDecimal("0.10");
    @Builder.Default
    private final BigDecimal emergencyBuffer = new BigDecimal("0.05");
    @Builder.Default
    private final BigDecimal maxBankrollFraction = new BigDecimal("0.5");
    // Cap on one liquidation-prevention margin top-up
    @Builder.Default
    private final BigDecimal maxMarginFraction = new BigDecimal("0.3");

    // Closed positions kept in memory by PositionBook, oldest dropped first
    @Builder.Default
    private final int archiveSize = 100;

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }

    /**
     * Check that every fraction is usable.
     *
     * @throws IllegalArgumentException naming the first bad parameter
     */
    public EngineSettings validate() {
        requireFraction("profitFraction", profitFraction, false);
        requireFraction("firstTakeFraction", firstTakeFraction, true);
        requireFraction("secondTakeFraction", secondTakeFraction, true);
        requireFraction("finalTakeFraction", finalTakeFraction, true);
        requireFraction("trailFraction", trailFraction, true);
        requireFraction("finalTrailFraction", finalTrailFraction, true);
        requireFraction("liquidationBuffer", liquidationBuffer, true);
        requireFraction("emergencyBuffer", emergencyBuffer, true);
        requireFraction("maxBankrollFraction", maxBankrollFraction, true);
        requireFraction("maxMarginFraction", maxMarginFraction, true);

        if (maxStages < 1) {
            throw new IllegalArgumentException("maxStages must be at least 1, was " + maxStages);
        }
        if (archiveSize < 0) {
            throw new IllegalArgumentException("archiveSize must be >= 0, was " + archiveSize);
        }
        if (neutralThreshold == null || neutralThreshold.signum() < 0) {
            throw new IllegalArgumentException("neutralThreshold must be >= 0, was " + neutralThreshold);
        }
        if (betterScoreRatio == null || betterScoreRatio.signum() <= 0) {
            throw new IllegalArgumentException("betterScoreRatio must be positive, was " + betterScoreRatio);
        }
        if (emergencyBuffer.compareTo(liquidationBuffer) > 0) {
            throw new IllegalArgumentException("emergencyBuffer must not exceed liquidationBuffer");
        }
        BigDecimal takeSum = firstTakeFraction.add(secondTakeFraction).add(finalTakeFraction);
        if (takeSum.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Take fractions add up to more than 100%: " + takeSum);
        }
        return this;
    }

    private static void requireFraction(String name, BigDecimal value, boolean capAtOne) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
        if (capAtOne && value.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException(name + " must be below 1, was " + value);
        }
    }
}
