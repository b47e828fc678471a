package com.zmart.scaler.winrate;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * Ranked scenarios with summary counts.
 */
@Data
@Builder
public class WinRateComparison {

    private final int totalScenarios;
    private final List<RankedScenario> rankings;

    private final RankedScenario bestOpportunity;  // null when empty
    private final int exceptionalCount;
    private final int tradeableCount;
    private final BigDecimal averageWinRate;

    private final List<RankedScenario> topThree;
    private final List<RankedScenario> exceptionalOpportunities;
    private final List<RankedScenario> avoidScenarios;
}
