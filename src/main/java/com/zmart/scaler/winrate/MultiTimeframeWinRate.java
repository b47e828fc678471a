package com.zmart.scaler.winrate;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Win-rate scores for all three timeframes of one symbol.
 */
@Data
@Builder
public class MultiTimeframeWinRate {

    private final String symbol;
    private final WinRateScore shortTerm;
    private final WinRateScore mediumTerm;
    private final WinRateScore longTerm;

    private final BigDecimal overallConfidence;
    private final WinRateDirection dominantDirection;
    private final WinRateScore bestOpportunity;

    private final LocalDateTime timestamp;

    /**
     * Scores in SHORT, MEDIUM, LONG order.
     */
    public List<WinRateScore> getScores() {
        return List.of(shortTerm, mediumTerm, longTerm);
    }
}
