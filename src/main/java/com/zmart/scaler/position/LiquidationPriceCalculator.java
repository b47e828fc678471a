package com.zmart.scaler.position;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Approximate liquidation prices from stage leverage and entry prices.
 *
 * Uses the isolated-margin formula entry x (1 -/+ 1/leverage) with no maintenance margin
 * or fees. Results are estimates until an exchange margin model is available.
 */
@Component
public class LiquidationPriceCalculator {

    private static final MathContext MC = new MathContext(18, RoundingMode.HALF_UP);

    /**
     * Blended estimate: the formula applied to the weighted average entry
     * with blended leverage totalPositionValue / (totalInvested + additionalMargin).
     */
    public BigDecimal estimate(Position position) {
        BigDecimal positionValue = position.totalPositionValue();
        if (positionValue.signum() == 0) {
            return BigDecimal.ZERO;
        }
        // 1 / blended leverage
        BigDecimal collateral = position.totalInvested().add(position.getAdditionalMargin());
        BigDecimal inverseLeverage = collateral.divide(positionValue, MC);
        // Collateral beyond the position value leaves no LONG liquidation price
        return applyFormula(position.getDirection(), position.weightedAverageEntryPrice(), inverseLeverage)
                .max(BigDecimal.ZERO);
    }

    /**
     * Position-value-weighted mean of each stage's own liquidation price.
     * Added margin is not attributed to stages and is ignored here.
     */
    public BigDecimal estimatePerStage(Position position) {
        BigDecimal positionValue = position.totalPositionValue();
        if (positionValue.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal weighted = BigDecimal.ZERO;
        for (Stage stage : position.getStages()) {
            BigDecimal inverseLeverage = BigDecimal.ONE.divide(stage.getLeverage(), MC);
            BigDecimal stageLiquidation = applyFormula(position.getDirection(), stage.getEntryPrice(), inverseLeverage);
            weighted = weighted.add(stageLiquidation.multiply(stage.getPositionValue()));
        }
        return weighted.divide(positionValue, MC);
    }

    /**
     * Fraction of the current price left before the blended liquidation estimate.
     * Negative once the price is beyond it.
     */
    public BigDecimal distanceFraction(Position position, BigDecimal currentPrice) {
        ProfitThresholdEngine.requireValidPrice(currentPrice);
        BigDecimal liquidation = estimate(position);
        BigDecimal gap = position.getDirection() == PositionDirection.LONG
                ? currentPrice.subtract(liquidation)
                : liquidation.subtract(currentPrice);
        return gap.divide(currentPrice, MC);
    }

    private BigDecimal applyFormula(PositionDirection direction, BigDecimal entry, BigDecimal inverseLeverage) {
        BigDecimal factor = direction == PositionDirection.LONG
                ? BigDecimal.ONE.subtract(inverseLeverage)
                : BigDecimal.ONE.add(inverseLeverage);
        return entry.multiply(factor, MC);
    }
}
