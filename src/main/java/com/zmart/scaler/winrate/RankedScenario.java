package com.zmart.scaler.winrate;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class RankedScenario {

    private final int rank;  // 1 = best
    private final String symbol;
    private final BigDecimal winRate;
    private final Timeframe timeframe;
    private final WinRateDirection direction;
    private final OpportunityLevel opportunityLevel;
    private final boolean tradeable;
    private final boolean exceptional;
}
