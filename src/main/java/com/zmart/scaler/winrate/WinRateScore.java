package com.zmart.scaler.winrate;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class WinRateScore {

    private final Timeframe timeframe;
    private final WinRateDirection direction;
    private final BigDecimal score;       // 0 - 100, win rate of the chosen direction
    private final BigDecimal confidence;  // 0 - 1
    private final OpportunityLevel opportunityLevel;
    private final String reasoning;

    // Raw inputs
    private final BigDecimal longWinRate;
    private final BigDecimal shortWinRate;
}
