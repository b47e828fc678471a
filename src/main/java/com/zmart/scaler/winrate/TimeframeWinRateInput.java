package com.zmart.scaler.winrate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Win-rate estimate for one timeframe as delivered by the analytics feed.
 * Missing numeric fields fall back to 50 / 50 / 0.7.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeframeWinRateInput {

    public static final BigDecimal DEFAULT_WIN_RATE = new BigDecimal("50");
    public static final BigDecimal DEFAULT_CONFIDENCE = new BigDecimal("0.7");

    private BigDecimal longWinRate;   // 0 - 100
    private BigDecimal shortWinRate;  // 0 - 100
    private BigDecimal confidence;    // 0 - 1
    private String reasoning;

    public static TimeframeWinRateInput of(double longWinRate, double shortWinRate, double confidence) {
        return TimeframeWinRateInput.builder()
                .longWinRate(BigDecimal.valueOf(longWinRate))
                .shortWinRate(BigDecimal.valueOf(shortWinRate))
                .confidence(BigDecimal.valueOf(confidence))
                .build();
    }

    public BigDecimal effectiveLongWinRate() {
        return longWinRate != null ? longWinRate : DEFAULT_WIN_RATE;
    }

    public BigDecimal effectiveShortWinRate() {
        return shortWinRate != null ? shortWinRate : DEFAULT_WIN_RATE;
    }

    public BigDecimal effectiveConfidence() {
        return confidence != null ? confidence : DEFAULT_CONFIDENCE;
    }
}
