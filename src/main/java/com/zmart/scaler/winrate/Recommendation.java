package com.zmart.scaler.winrate;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * Trading call derived from a multi-timeframe analysis.
 */
@Data
@Builder
public class Recommendation {

    private final String symbol;
    private final TradeAction overallRecommendation;
    private final BigDecimal positionSizeFraction;  // 0 for HOLD
    private final RiskLevel riskLevel;

    private final Timeframe bestTimeframe;
    private final OpportunityLevel bestOpportunityLevel;
    private final BigDecimal bestScore;
    private final BigDecimal confidence;
    private final String action;

    private final List<TimeframeRecommendation> timeframes;
    private final String reasoning;

    public boolean isHold() {
        return overallRecommendation == TradeAction.HOLD;
    }
}
