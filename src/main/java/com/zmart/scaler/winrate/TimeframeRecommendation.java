package com.zmart.scaler.winrate;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class TimeframeRecommendation {

    private final Timeframe timeframe;
    private final WinRateDirection direction;
    private final BigDecimal score;
    private final OpportunityLevel opportunityLevel;
    private final BigDecimal positionSizeFraction;
    private final RiskLevel riskLevel;
    private final String action;
}
