package com.zmart.scaler.winrate;

import com.zmart.scaler.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ranks arbitrary win-rate scenarios, highest first. Equal win rates keep input order.
 */
@Component
@Slf4j
public class WinRateComparator {

    private static final MathContext MC = new MathContext(18, RoundingMode.HALF_UP);
    private static final BigDecimal DEFAULT_WIN_RATE = new BigDecimal("50");

    public WinRateComparison compare(List<WinRateScenario> scenarios) {
        log.info("Comparing {} win rate scenarios", scenarios.size());

        List<WinRateScenario> normalized = new ArrayList<>();
        for (int i = 0; i < scenarios.size(); i++) {
            normalized.add(normalize(scenarios.get(i), i));
        }
        normalized.sort(Comparator.comparing(WinRateScenario::getWinRate).reversed());

        List<RankedScenario> rankings = new ArrayList<>();
        for (int i = 0; i < normalized.size(); i++) {
            WinRateScenario scenario = normalized.get(i);
            BigDecimal winRate = scenario.getWinRate();
            rankings.add(RankedScenario.builder()
                    .rank(i + 1)
                    .symbol(scenario.getSymbol())
                    .winRate(winRate)
                    .timeframe(scenario.getTimeframe())
                    .direction(scenario.getDirection())
                    .opportunityLevel(OpportunityLevel.classify(winRate))
                    .tradeable(OpportunityLevel.isTradeable(winRate))
                    .exceptional(OpportunityLevel.isExceptional(winRate))
                    .build());
        }

        List<RankedScenario> exceptional = rankings.stream()
                .filter(RankedScenario::isExceptional)
                .collect(Collectors.toList());
        List<RankedScenario> avoid = rankings.stream()
                .filter(r -> !r.isTradeable())
                .collect(Collectors.toList());
        int tradeableCount = rankings.size() - avoid.size();

        BigDecimal average = BigDecimal.ZERO;
        if (!rankings.isEmpty()) {
            BigDecimal sum = rankings.stream()
                    .map(RankedScenario::getWinRate)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            average = sum.divide(BigDecimal.valueOf(rankings.size()), MC);
        }

        return WinRateComparison.builder()
                .totalScenarios(rankings.size())
                .rankings(rankings)
                .bestOpportunity(rankings.isEmpty() ? null : rankings.get(0))
                .exceptionalCount(exceptional.size())
                .tradeableCount(tradeableCount)
                .averageWinRate(average)
                .topThree(new ArrayList<>(rankings.subList(0, Math.min(3, rankings.size()))))
                .exceptionalOpportunities(exceptional)
                .avoidScenarios(avoid)
                .build();
    }

    private WinRateScenario normalize(WinRateScenario scenario, int index) {
        BigDecimal winRate = scenario.getWinRate() != null ? scenario.getWinRate() : DEFAULT_WIN_RATE;
        if (winRate.signum() < 0 || winRate.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new ValidationException("win_rate", "must be between 0 and 100, was " + winRate);
        }
        return WinRateScenario.builder()
                .symbol(scenario.getSymbol() != null ? scenario.getSymbol() : "SCENARIO_" + (index + 1))
                .winRate(winRate)
                .timeframe(scenario.getTimeframe() != null ? scenario.getTimeframe() : Timeframe.SHORT_TERM)
                .direction(scenario.getDirection() != null ? scenario.getDirection() : WinRateDirection.LONG)
                .build();
    }
}
