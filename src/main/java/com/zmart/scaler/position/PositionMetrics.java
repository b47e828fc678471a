package com.zmart.scaler.position;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Snapshot of a position's figures at one price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionMetrics {

    private String symbol;
    private PositionDirection direction;
    private PositionStatus status;
    private int stageCount;
    private BigDecimal currentPrice;

    // Ledger totals
    private BigDecimal totalInvested;
    private BigDecimal totalPositionValue;
    private BigDecimal averageEntryPrice;

    // Margin and thresholds
    private BigDecimal currentMargin;
    private BigDecimal profitThreshold;
    private BigDecimal firstTakeProfitTrigger;
    private boolean firstTakeProfitReached;
    private BigDecimal unrealizedPnl;
    private BigDecimal profitPercentage;

    // Approximate
    private BigDecimal liquidationPrice;
    private BigDecimal liquidationDistance;

    // Exit ladder amounts
    private BigDecimal firstTakeAmount;
    private BigDecimal secondTakeAmount;
    private BigDecimal finalTakeAmount;

    private BigDecimal maxLoss;
    private BigDecimal breakEvenPrice;
    private BigDecimal riskRewardRatio;

    private BigDecimal remainingPositionValue;
    private BigDecimal realizedPnl;
    private BigDecimal trailingStopPrice;
}
