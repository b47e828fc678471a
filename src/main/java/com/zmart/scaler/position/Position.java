package com.zmart.scaler.position;

import com.zmart.scaler.exception.InvalidStageException;
import com.zmart.scaler.exception.InvalidTransitionException;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate of all stages for one instrument and direction.
 *
 * Created with its first stage. Stages are appended only while ACCUMULATING;
 * every other mutation goes through {@link TakeProfitStateMachine}.
 * Not thread-safe: callers serialize access per instrument (see PositionBook).
 */
@Getter
public class Position {

    private final String id;
    private final String symbol;
    private final PositionDirection direction;
    private final LocalDateTime openedAt;

    @Getter(lombok.AccessLevel.NONE)
    private final StageLedger ledger;

    private PositionStatus status = PositionStatus.ACCUMULATING;

    // Set once status leaves ACCUMULATING
    private BigDecimal trailingStopPrice;
    private BigDecimal activeTrailFraction;

    // Position value already closed by takes, and the profit booked with it
    private BigDecimal realizedPositionValue = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private int takeProfitCount;

    // Collateral posted on top of the stage investments, lowers leverage without adding value
    private BigDecimal additionalMargin = BigDecimal.ZERO;
    private LocalDateTime marginAddedAt;
    private String marginAddReason;

    private BigDecimal closePrice;
    private LocalDateTime closedAt;

    private Position(String symbol, PositionDirection direction, int maxStages) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction is required");
        }
        this.id = UUID.randomUUID().toString();
        this.symbol = symbol;
        this.direction = direction;
        this.openedAt = LocalDateTime.now();
        this.ledger = new StageLedger(maxStages);
    }

    /**
     * Open a position with its first stage.
     *
     * @throws InvalidStageException if the first stage is invalid
     */
    public static Position open(String symbol, PositionDirection direction, int maxStages,
                                BigDecimal investment, BigDecimal leverage, BigDecimal entryPrice) {
        Position position = new Position(symbol, direction, maxStages);
        position.ledger.append(investment, leverage, entryPrice);
        return position;
    }

    /**
     * Append a stage while the position is still accumulating.
     *
     * @return this position, with totals recomputed from the new stage list
     * @throws InvalidStageException on invalid input, a full ledger, or a non-accumulating status
     */
    public Position addStage(BigDecimal investment, BigDecimal leverage, BigDecimal entryPrice) {
        if (status != PositionStatus.ACCUMULATING) {
            throw new InvalidStageException(
                    "Cannot add a stage to " + symbol + " in status " + status);
        }
        ledger.append(investment, leverage, entryPrice);
        return this;
    }

    /**
     * Post extra collateral against the open position.
     *
     * @throws InvalidStageException if the amount is not positive
     * @throws InvalidTransitionException if the position is closed
     */
    public Position addMargin(BigDecimal amount, String reason) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidStageException("Margin must be positive, was " + amount);
        }
        if (status == PositionStatus.CLOSED) {
            throw new InvalidTransitionException(status, "Cannot add margin to closed position " + symbol);
        }
        this.additionalMargin = additionalMargin.add(amount);
        this.marginAddedAt = LocalDateTime.now();
        this.marginAddReason = reason;
        return this;
    }

    public List<Stage> getStages() {
        return ledger.getStages();
    }

    public int getStageCount() {
        return ledger.size();
    }

    public int getMaxStages() {
        return ledger.getMaxStages();
    }

    public boolean canAddStage() {
        return status == PositionStatus.ACCUMULATING && !ledger.isFull();
    }

    public BigDecimal totalInvested() {
        return ledger.totalInvested();
    }

    public BigDecimal totalPositionValue() {
        return ledger.totalPositionValue();
    }

    public BigDecimal weightedAverageEntryPrice() {
        return ledger.weightedAverageEntryPrice();
    }

    /**
     * Position value still open: total position value minus what takes have closed.
     */
    public BigDecimal remainingPositionValue() {
        return totalPositionValue().subtract(realizedPositionValue);
    }

    /**
     * True when the price has crossed the trailing stop against the position.
     */
    public boolean isStopCrossed(BigDecimal price) {
        if (trailingStopPrice == null) {
            return false;
        }
        return direction == PositionDirection.LONG
                ? price.compareTo(trailingStopPrice) <= 0
                : price.compareTo(trailingStopPrice) >= 0;
    }

    // ----- Mutators reserved for the take-profit state machine -----

    void moveTo(PositionStatus newStatus) {
        this.status = newStatus;
    }

    void armTrailingStop(BigDecimal stopPrice, BigDecimal trailFraction) {
        this.trailingStopPrice = stopPrice;
        this.activeTrailFraction = trailFraction;
    }

    void moveTrailingStop(BigDecimal stopPrice) {
        this.trailingStopPrice = stopPrice;
    }

    void recordTake(BigDecimal closedValue, BigDecimal pnl) {
        this.realizedPositionValue = realizedPositionValue.add(closedValue);
        this.realizedPnl = realizedPnl.add(pnl);
        this.takeProfitCount++;
    }

    void recordClose(BigDecimal closedValue, BigDecimal pnl, BigDecimal price, LocalDateTime at) {
        this.realizedPositionValue = realizedPositionValue.add(closedValue);
        this.realizedPnl = realizedPnl.add(pnl);
        this.closePrice = price;
        this.closedAt = at;
        this.status = PositionStatus.CLOSED;
    }

    @Override
    public String toString() {
        return String.format("Position[%s %s %s, stages=%d, invested=%s, value=%s, avgEntry=%s, stop=%s]",
                symbol, direction, status, ledger.size(), totalInvested(), totalPositionValue(),
                weightedAverageEntryPrice(), trailingStopPrice);
    }
}
