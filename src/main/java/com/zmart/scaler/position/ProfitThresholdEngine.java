package com.zmart.scaler.position;

import com.zmart.scaler.config.EngineSettings;
import com.zmart.scaler.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Margin and profit-threshold arithmetic against the current stage ledger.
 *
 * Margin here is an amount, not a price: invested capital plus unrealized PnL.
 * Thresholds are recomputed from {@code totalInvested} on every call, so they
 * follow the ledger after each append.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProfitThresholdEngine {

    private static final MathContext MC = new MathContext(18, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final EngineSettings settings;

    public BigDecimal profitThreshold(BigDecimal totalInvested) {
        return totalInvested.multiply(settings.getProfitFraction());
    }

    /**
     * Margin level at which the first take-profit fires: invested + threshold.
     */
    public BigDecimal firstTakeProfitTrigger(BigDecimal totalInvested) {
        return totalInvested.add(profitThreshold(totalInvested));
    }

    public BigDecimal firstTakeProfitTrigger(Position position) {
        return firstTakeProfitTrigger(position.totalInvested());
    }

    /**
     * LONG: (price - avg) / avg x positionValue + invested.
     * SHORT: (avg - price) / avg x positionValue + invested.
     */
    public BigDecimal currentMargin(Position position, BigDecimal currentPrice) {
        return position.totalInvested().add(unrealizedPnl(position, currentPrice));
    }

    public boolean hasReachedFirstTakeProfit(Position position, BigDecimal currentPrice) {
        BigDecimal margin = currentMargin(position, currentPrice);
        BigDecimal trigger = firstTakeProfitTrigger(position);
        boolean reached = margin.compareTo(trigger) >= 0;

        log.debug("{} margin={} trigger={} reached={}",
                position.getSymbol(), margin.setScale(2, RoundingMode.HALF_UP), trigger, reached);
        return reached;
    }

    /**
     * Profit or loss of the full position value at the given price.
     */
    public BigDecimal unrealizedPnl(Position position, BigDecimal currentPrice) {
        requireValidPrice(currentPrice);
        BigDecimal avg = position.weightedAverageEntryPrice();
        if (avg.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal move = currentPrice.subtract(avg)
                .multiply(BigDecimal.valueOf(position.getDirection().sign()));
        return move.divide(avg, MC).multiply(position.totalPositionValue(), MC);
    }

    /**
     * Unrealized PnL as a percentage of total invested, scale 2.
     */
    public BigDecimal profitPercentage(Position position, BigDecimal currentPrice) {
        BigDecimal invested = position.totalInvested();
        if (invested.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return unrealizedPnl(position, currentPrice)
                .divide(invested, MC)
                .multiply(HUNDRED)
                .setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Marked-to-market notional: total position value plus unrealized PnL.
     */
    public BigDecimal markedPositionValue(Position position, BigDecimal currentPrice) {
        return position.totalPositionValue().add(unrealizedPnl(position, currentPrice));
    }

    static void requireValidPrice(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new ValidationException("current_price", "must be positive, was " + price);
        }
    }
}
