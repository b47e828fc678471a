package com.zmart.scaler.winrate;

import com.zmart.scaler.config.EngineSettings;
import com.zmart.scaler.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns per-timeframe long/short win rates into scores, a multi-timeframe analysis
 * and a trading recommendation.
 *
 * Stateless apart from the settings it was built with; safe to call concurrently.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WinRateScorer {

    private static final BigDecimal MAX_WIN_RATE = BigDecimal.valueOf(100);

    private final EngineSettings settings;

    public OpportunityLevel classifyOpportunity(BigDecimal score) {
        return OpportunityLevel.classify(score);
    }

    public WinRateDirection determineDirection(BigDecimal longScore, BigDecimal shortScore) {
        return determineDirection(longScore, shortScore, settings.getNeutralThreshold());
    }

    /**
     * NEUTRAL when the two scores are within the threshold of each other (inclusive),
     * otherwise the larger side.
     */
    public WinRateDirection determineDirection(BigDecimal longScore, BigDecimal shortScore,
                                               BigDecimal neutralThreshold) {
        BigDecimal diff = longScore.subtract(shortScore).abs();
        if (diff.compareTo(neutralThreshold) <= 0) {
            return WinRateDirection.NEUTRAL;
        }
        return longScore.compareTo(shortScore) > 0 ? WinRateDirection.LONG : WinRateDirection.SHORT;
    }

    public WinRateScore createWinRateScore(Timeframe timeframe, BigDecimal longWinRate,
                                           BigDecimal shortWinRate, BigDecimal confidence) {
        return createWinRateScore(timeframe, longWinRate, shortWinRate, confidence, null);
    }

    /**
     * Score one timeframe. The score is the winning side's win rate, or the larger of the two
     * when NEUTRAL, clamped to [0, 100]. Confidence is clamped to [0, 1].
     */
    public WinRateScore createWinRateScore(Timeframe timeframe, BigDecimal longWinRate,
                                           BigDecimal shortWinRate, BigDecimal confidence,
                                           String reasoning) {
        WinRateDirection direction = determineDirection(longWinRate, shortWinRate);

        BigDecimal score = switch (direction) {
            case LONG -> longWinRate;
            case SHORT -> shortWinRate;
            case NEUTRAL -> longWinRate.max(shortWinRate);
        };
        score = clamp(score, BigDecimal.ZERO, MAX_WIN_RATE);
        BigDecimal clampedConfidence = clamp(confidence, BigDecimal.ZERO, BigDecimal.ONE);

        OpportunityLevel level = classifyOpportunity(score);

        if (reasoning == null || reasoning.isBlank()) {
            reasoning = String.format("%s analysis shows %s bias with %s%% win rate (%s opportunity)",
                    timeframe.getDisplayName(), direction, score.setScale(1, RoundingMode.HALF_UP),
                    level.getDisplayName());
        }

        return WinRateScore.builder()
                .timeframe(timeframe)
                .direction(direction)
                .score(score)
                .confidence(clampedConfidence)
                .opportunityLevel(level)
                .reasoning(reasoning)
                .longWinRate(longWinRate)
                .shortWinRate(shortWinRate)
                .build();
    }

    /**
     * Check ranges of an input record. Absent fields are valid (they take defaults).
     *
     * @throws ValidationException naming long_win_rate, short_win_rate or confidence
     */
    public void validateWinRateData(TimeframeWinRateInput input) {
        if (input == null) {
            return;
        }
        requireRange("long_win_rate", input.effectiveLongWinRate(), BigDecimal.ZERO, MAX_WIN_RATE);
        requireRange("short_win_rate", input.effectiveShortWinRate(), BigDecimal.ZERO, MAX_WIN_RATE);
        requireRange("confidence", input.effectiveConfidence(), BigDecimal.ZERO, BigDecimal.ONE);
    }

    /**
     * Score all three timeframes for one symbol.
     *
     * Overall confidence is the timeframe-weighted confidence (40/35/25). The dominant direction
     * is the majority vote, ties going to LONG, then SHORT, then NEUTRAL. The best opportunity is
     * the highest score, ties going to the shorter timeframe.
     */
    public MultiTimeframeWinRate createMultiTimeframeAnalysis(String symbol,
                                                              TimeframeWinRateInput shortData,
                                                              TimeframeWinRateInput mediumData,
                                                              TimeframeWinRateInput longData) {
        validateWinRateData(shortData);
        validateWinRateData(mediumData);
        validateWinRateData(longData);

        WinRateScore shortTerm = scoreFor(Timeframe.SHORT_TERM, shortData);
        WinRateScore mediumTerm = scoreFor(Timeframe.MEDIUM_TERM, mediumData);
        WinRateScore longTerm = scoreFor(Timeframe.LONG_TERM, longData);
        List<WinRateScore> scores = List.of(shortTerm, mediumTerm, longTerm);

        BigDecimal overallConfidence = BigDecimal.ZERO;
        for (WinRateScore score : scores) {
            overallConfidence = overallConfidence.add(score.getTimeframe().getWeight().multiply(score.getConfidence()));
        }

        WinRateScore best = shortTerm;
        for (WinRateScore score : scores) {
            if (score.getScore().compareTo(best.getScore()) > 0) {
                best = score;
            }
        }

        MultiTimeframeWinRate analysis = MultiTimeframeWinRate.builder()
                .symbol(symbol)
                .shortTerm(shortTerm)
                .mediumTerm(mediumTerm)
                .longTerm(longTerm)
                .overallConfidence(overallConfidence)
                .dominantDirection(dominantDirection(scores))
                .bestOpportunity(best)
                .timestamp(LocalDateTime.now())
                .build();

        log.info("Win-rate analysis for {}: dominant={}, best={} {} ({}), confidence={}",
                symbol, analysis.getDominantDirection(), best.getTimeframe().getCode(),
                best.getScore(), best.getOpportunityLevel(), overallConfidence);
        return analysis;
    }

    /**
     * Map an analysis to position size, risk and an overall LONG / SHORT / HOLD call.
     * WEAK and AVOID best opportunities, and a NEUTRAL best opportunity, yield HOLD with size 0.
     */
    public Recommendation getTradingRecommendations(MultiTimeframeWinRate analysis) {
        List<TimeframeRecommendation> perTimeframe = new ArrayList<>();
        for (WinRateScore score : analysis.getScores()) {
            OpportunityLevel level = score.getOpportunityLevel();
            perTimeframe.add(TimeframeRecommendation.builder()
                    .timeframe(score.getTimeframe())
                    .direction(score.getDirection())
                    .score(score.getScore())
                    .opportunityLevel(level)
                    .positionSizeFraction(level.getPositionSize())
                    .riskLevel(level.getRiskLevel())
                    .action(level.getAction())
                    .build());
        }

        WinRateScore best = analysis.getBestOpportunity();
        OpportunityLevel bestLevel = best.getOpportunityLevel();

        TradeAction overall;
        BigDecimal positionSize;
        String reasoning;
        if (bestLevel.collapsesToHold()) {
            overall = TradeAction.HOLD;
            positionSize = BigDecimal.ZERO;
            reasoning = String.format("Best opportunity is %s (%s%%) on %s, no trade",
                    bestLevel.getDisplayName(), best.getScore(), best.getTimeframe().getCode());
        } else if (best.getDirection() == WinRateDirection.NEUTRAL) {
            overall = TradeAction.HOLD;
            positionSize = BigDecimal.ZERO;
            reasoning = String.format("No directional edge on %s (long %s%% vs short %s%%)",
                    best.getTimeframe().getCode(), best.getLongWinRate(), best.getShortWinRate());
        } else {
            overall = best.getDirection() == WinRateDirection.LONG ? TradeAction.LONG : TradeAction.SHORT;
            positionSize = bestLevel.getPositionSize();
            reasoning = String.format("%s %s setup on %s with %s%% win rate",
                    bestLevel.getDisplayName(), best.getDirection(), best.getTimeframe().getCode(),
                    best.getScore());
        }

        log.debug("Recommendation for {}: {} size={} risk={}",
                analysis.getSymbol(), overall, positionSize, bestLevel.getRiskLevel());

        return Recommendation.builder()
                .symbol(analysis.getSymbol())
                .overallRecommendation(overall)
                .positionSizeFraction(positionSize)
                .riskLevel(bestLevel.getRiskLevel())
                .bestTimeframe(best.getTimeframe())
                .bestOpportunityLevel(bestLevel)
                .bestScore(best.getScore())
                .confidence(analysis.getOverallConfidence())
                .action(bestLevel.getAction())
                .timeframes(perTimeframe)
                .reasoning(reasoning)
                .build();
    }

    private WinRateScore scoreFor(Timeframe timeframe, TimeframeWinRateInput input) {
        TimeframeWinRateInput data = input != null ? input : new TimeframeWinRateInput();
        return createWinRateScore(timeframe, data.effectiveLongWinRate(), data.effectiveShortWinRate(),
                data.effectiveConfidence(), data.getReasoning());
    }

    private WinRateDirection dominantDirection(List<WinRateScore> scores) {
        Map<WinRateDirection, Integer> votes = new EnumMap<>(WinRateDirection.class);
        for (WinRateScore score : scores) {
            votes.merge(score.getDirection(), 1, Integer::sum);
        }
        WinRateDirection dominant = WinRateDirection.LONG;
        int best = votes.getOrDefault(dominant, 0);
        // Declaration order LONG, SHORT, NEUTRAL breaks ties
        for (WinRateDirection direction : WinRateDirection.values()) {
            int count = votes.getOrDefault(direction, 0);
            if (count > best) {
                dominant = direction;
                best = count;
            }
        }
        return dominant;
    }

    private static void requireRange(String field, BigDecimal value, BigDecimal min, BigDecimal max) {
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw new ValidationException(field, "must be between " + min + " and " + max + ", was " + value);
        }
    }

    private static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        return value.max(min).min(max);
    }
}
