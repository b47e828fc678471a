package com.zmart.scaler.position;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One position state transition, with the amounts it realized.
 */
@Data
@Builder
public class PositionEvent {

    private final PositionEventType type;
    private final String positionId;
    private final String symbol;
    private final PositionStatus status;     // status after the transition
    private final BigDecimal price;

    private final BigDecimal realizedAmount; // position value closed by this event
    private final BigDecimal realizedPnl;    // profit booked with it
    private final BigDecimal remainingPositionValue;
    private final BigDecimal trailingStopPrice;

    private final LocalDateTime occurredAt;

    public String toSummary() {
        return String.format("%s %s @ %s: realized=%s, remaining=%s, stop=%s",
                symbol, type.getDisplayName(), price, realizedAmount, remainingPositionValue,
                trailingStopPrice != null ? trailingStopPrice : "-");
    }
}
