package com.zmart.scaler.winrate;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;

/**
 * Plain-text report of a multi-timeframe analysis.
 */
@Component
public class WinRateReportFormatter {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String SEPARATOR = "=".repeat(48);

    public String format(MultiTimeframeWinRate analysis) {
        StringBuilder sb = new StringBuilder();
        sb.append("WIN RATE ANALYSIS: ").append(analysis.getSymbol()).append("\n");
        sb.append(SEPARATOR).append("\n");
        if (analysis.getTimestamp() != null) {
            sb.append("Generated: ").append(analysis.getTimestamp().format(TIME_FORMAT)).append("\n");
        }
        sb.append("\n");

        for (WinRateScore score : analysis.getScores()) {
            Timeframe timeframe = score.getTimeframe();
            sb.append(String.format("%s (%s):%n", timeframe.getDisplayName(), timeframe.getCode()));
            sb.append(String.format("  Direction:   %s%n", score.getDirection()));
            sb.append(String.format("  Win rate:    %s%% (long %s%% / short %s%%)%n",
                    oneDecimal(score.getScore()), oneDecimal(score.getLongWinRate()),
                    oneDecimal(score.getShortWinRate())));
            sb.append(String.format("  Opportunity: %s [%s]%n",
                    score.getOpportunityLevel().getDisplayName(), score.getOpportunityLevel().getWinRateRange()));
            sb.append(String.format("  Confidence:  %s%%%n", percent(score.getConfidence())));
            sb.append(String.format("  Reasoning:   %s%n", score.getReasoning()));
            sb.append("\n");
        }

        WinRateScore best = analysis.getBestOpportunity();
        sb.append("SUMMARY\n");
        sb.append(String.format("  Dominant direction: %s%n", analysis.getDominantDirection()));
        sb.append(String.format("  Overall confidence: %s%%%n", percent(analysis.getOverallConfidence())));
        sb.append(String.format("  Best opportunity:   %s %s at %s%% (%s)%n",
                best.getTimeframe().getDisplayName(), best.getDirection(), oneDecimal(best.getScore()),
                best.getOpportunityLevel().getDisplayName()));
        sb.append(String.format("  Action:             %s%n", best.getOpportunityLevel().getAction()));
        sb.append(SEPARATOR).append("\n");

        return sb.toString();
    }

    private static String oneDecimal(BigDecimal value) {
        return value == null ? "-" : value.setScale(1, RoundingMode.HALF_UP).toPlainString();
    }

    private static String percent(BigDecimal fraction) {
        return fraction.multiply(BigDecimal.valueOf(100)).setScale(1, RoundingMode.HALF_UP).toPlainString();
    }
}
