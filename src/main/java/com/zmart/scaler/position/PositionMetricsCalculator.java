package com.zmart.scaler.position;

import com.zmart.scaler.config.EngineSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Bundles ledger totals, margin, thresholds, liquidation and exit amounts for one price.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PositionMetricsCalculator {

    private static final MathContext MC = new MathContext(18, RoundingMode.HALF_UP);
    private static final int SCALE = 4;

    private final EngineSettings settings;
    private final ProfitThresholdEngine thresholds;
    private final LiquidationPriceCalculator liquidation;

    public PositionMetrics calculate(Position position, BigDecimal currentPrice) {
        BigDecimal invested = position.totalInvested();
        BigDecimal positionValue = position.totalPositionValue();
        BigDecimal threshold = thresholds.profitThreshold(invested);

        // Whole position can be lost at most, so risk is what was invested
        BigDecimal maxLoss = invested;
        BigDecimal riskReward = maxLoss.signum() == 0
                ? BigDecimal.ZERO
                : threshold.divide(maxLoss, MC).setScale(SCALE, RoundingMode.HALF_UP);

        PositionMetrics metrics = PositionMetrics.builder()
                .symbol(position.getSymbol())
                .direction(position.getDirection())
                .status(position.getStatus())
                .stageCount(position.getStageCount())
                .currentPrice(currentPrice)
                .totalInvested(invested)
                .totalPositionValue(positionValue)
                .averageEntryPrice(position.weightedAverageEntryPrice())
                .currentMargin(thresholds.currentMargin(position, currentPrice))
                .profitThreshold(threshold)
                .firstTakeProfitTrigger(thresholds.firstTakeProfitTrigger(invested))
                .firstTakeProfitReached(thresholds.hasReachedFirstTakeProfit(position, currentPrice))
                .unrealizedPnl(thresholds.unrealizedPnl(position, currentPrice))
                .profitPercentage(thresholds.profitPercentage(position, currentPrice))
                .liquidationPrice(liquidation.estimate(position))
                .liquidationDistance(liquidation.distanceFraction(position, currentPrice))
                .firstTakeAmount(positionValue.multiply(settings.getFirstTakeFraction()))
                .secondTakeAmount(positionValue.multiply(settings.getSecondTakeFraction()))
                .finalTakeAmount(positionValue.multiply(settings.getFinalTakeFraction()))
                .maxLoss(maxLoss)
                .breakEvenPrice(position.weightedAverageEntryPrice())
                .riskRewardRatio(riskReward)
                .remainingPositionValue(position.remainingPositionValue())
                .realizedPnl(position.getRealizedPnl())
                .trailingStopPrice(position.getTrailingStopPrice())
                .build();

        log.debug("Metrics for {} at {}: margin={}, trigger={}, liq={}",
                position.getSymbol(), currentPrice, metrics.getCurrentMargin(),
                metrics.getFirstTakeProfitTrigger(), metrics.getLiquidationPrice());
        return metrics;
    }
}
