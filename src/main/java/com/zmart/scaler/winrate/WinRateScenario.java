package com.zmart.scaler.winrate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One entry of a scenario comparison. Absent fields take defaults when ranked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WinRateScenario {

    private String symbol;
    private BigDecimal winRate;
    private Timeframe timeframe;
    private WinRateDirection direction;

    public static WinRateScenario of(String symbol, String winRate) {
        return WinRateScenario.builder()
                .symbol(symbol)
                .winRate(new BigDecimal(winRate))
                .build();
    }
}
