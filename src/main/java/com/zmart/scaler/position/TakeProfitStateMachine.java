package com.zmart.scaler.position;

import com.zmart.scaler.config.EngineSettings;
import com.zmart.scaler.exception.InvalidTransitionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Drives a position through ACCUMULATING -> FIRST_TAKE -> TRAILING -> CLOSED.
 *
 * Every transition produces exactly one {@link PositionEvent}. A take closes a fraction of
 * the total position value (capped at what is still open) and books
 * {@code closedValue x (price - avg) / avg} as profit, sign-adjusted for SHORT.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TakeProfitStateMachine {

    private static final MathContext MC = new MathContext(18, RoundingMode.HALF_UP);

    private final EngineSettings settings;
    private final ProfitThresholdEngine thresholds;
    private final SubsequentTakeProfitPolicy subsequentTakePolicy;

    /**
     * Evaluate one price tick.
     *
     * @return events produced by this tick, empty when nothing changed
     */
    public List<PositionEvent> onPriceUpdate(Position position, PriceTick tick) {
        BigDecimal price = tick.getCurrentPrice();
        ProfitThresholdEngine.requireValidPrice(price);
        LocalDateTime at = tick.getTimestamp() != null ? tick.getTimestamp() : LocalDateTime.now();

        return switch (position.getStatus()) {
            case ACCUMULATING -> thresholds.hasReachedFirstTakeProfit(position, price)
                    ? List.of(triggerFirstTakeProfit(position, price, at))
                    : Collections.emptyList();
            case FIRST_TAKE, TRAILING -> onTrailingTick(position, price, at);
            case CLOSED -> {
                log.debug("Ignoring tick for closed position {}", position.getSymbol());
                yield Collections.emptyList();
            }
        };
    }

    /**
     * Realize the first take at the given price and arm the trailing stop.
     * Ends in TRAILING; FIRST_TAKE is passed through within the same call.
     *
     * @throws InvalidTransitionException if the first take was already consumed or the position is closed
     */
    public PositionEvent triggerFirstTakeProfit(Position position, BigDecimal price, LocalDateTime at) {
        ProfitThresholdEngine.requireValidPrice(price);
        if (position.getStatus() != PositionStatus.ACCUMULATING) {
            throw new InvalidTransitionException(position.getStatus(),
                    "First take-profit already consumed for " + position.getSymbol());
        }

        BigDecimal closedValue = takeAmount(position, settings.getFirstTakeFraction());
        BigDecimal pnl = realizedPnl(position, closedValue, price);

        position.moveTo(PositionStatus.FIRST_TAKE);
        position.recordTake(closedValue, pnl);
        position.armTrailingStop(stopFrom(position, price, settings.getTrailFraction()), settings.getTrailFraction());
        position.moveTo(PositionStatus.TRAILING);

        log.info("First take-profit on {} at {}: realized {} of {} (pnl {}), remaining {}, stop {}",
                position.getSymbol(), price, closedValue, position.totalPositionValue(),
                pnl.setScale(2, RoundingMode.HALF_UP), position.remainingPositionValue(),
                position.getTrailingStopPrice());

        return event(PositionEventType.FIRST_TAKE_TRIGGERED, position, price, closedValue, pnl, at);
    }

    /**
     * Close whatever is still open at the given price.
     *
     * @throws InvalidTransitionException if the position is already closed
     */
    public PositionEvent close(Position position, BigDecimal price, LocalDateTime at) {
        ProfitThresholdEngine.requireValidPrice(price);
        if (position.getStatus() == PositionStatus.CLOSED) {
            throw new InvalidTransitionException(PositionStatus.CLOSED,
                    "Position " + position.getSymbol() + " is already closed");
        }
        PositionEvent event = closeRemaining(position, price, at, PositionEventType.POSITION_CLOSED);
        log.info("Position {} closed manually at {}, total realized pnl {}",
                position.getSymbol(), price, position.getRealizedPnl().setScale(2, RoundingMode.HALF_UP));
        return event;
    }

    private List<PositionEvent> onTrailingTick(Position position, BigDecimal price, LocalDateTime at) {
        ratchetStop(position, price);

        Optional<SubsequentTake> followUp = subsequentTakePolicy.evaluate(position, price);
        if (followUp.isPresent()) {
            return List.of(applySubsequentTake(position, followUp.get(), price, at));
        }

        if (position.isStopCrossed(price)) {
            PositionEvent event = closeRemaining(position, price, at, PositionEventType.TRAILING_STOP_HIT);
            log.info("Trailing stop hit on {} at {} (stop {}), total realized pnl {}",
                    position.getSymbol(), price, position.getTrailingStopPrice(),
                    position.getRealizedPnl().setScale(2, RoundingMode.HALF_UP));
            return List.of(event);
        }
        return Collections.emptyList();
    }

    // Stop follows favorable price, never retreats
    private void ratchetStop(Position position, BigDecimal price) {
        BigDecimal candidate = stopFrom(position, price, position.getActiveTrailFraction());
        BigDecimal current = position.getTrailingStopPrice();
        boolean favorable = position.getDirection() == PositionDirection.LONG
                ? candidate.compareTo(current) > 0
                : candidate.compareTo(current) < 0;
        if (favorable) {
            position.moveTrailingStop(candidate);
            log.debug("Trailing stop for {} moved {} -> {}", position.getSymbol(), current, candidate);
        }
    }

    private PositionEvent applySubsequentTake(Position position, SubsequentTake take,
                                              BigDecimal price, LocalDateTime at) {
        BigDecimal closedValue = takeAmount(position, take.getCloseFraction());
        BigDecimal pnl = realizedPnl(position, closedValue, price);

        position.recordTake(closedValue, pnl);
        position.armTrailingStop(stopFrom(position, price, take.getNextTrailFraction()), take.getNextTrailFraction());

        log.info("Take #{} on {} at {} ({}): realized {}, remaining {}, stop {}",
                position.getTakeProfitCount(), position.getSymbol(), price, take.getReason(),
                closedValue, position.remainingPositionValue(), position.getTrailingStopPrice());

        return event(PositionEventType.SECOND_TAKE_TRIGGERED, position, price, closedValue, pnl, at);
    }

    private PositionEvent closeRemaining(Position position, BigDecimal price, LocalDateTime at,
                                         PositionEventType type) {
        BigDecimal closedValue = position.remainingPositionValue();
        BigDecimal pnl = realizedPnl(position, closedValue, price);
        position.recordClose(closedValue, pnl, price, at);
        return event(type, position, price, closedValue, pnl, at);
    }

    private BigDecimal takeAmount(Position position, BigDecimal fraction) {
        BigDecimal amount = position.totalPositionValue().multiply(fraction);
        return amount.min(position.remainingPositionValue());
    }

    private BigDecimal realizedPnl(Position position, BigDecimal closedValue, BigDecimal price) {
        BigDecimal avg = position.weightedAverageEntryPrice();
        BigDecimal move = price.subtract(avg).multiply(BigDecimal.valueOf(position.getDirection().sign()));
        return closedValue.multiply(move).divide(avg, MC);
    }

    private BigDecimal stopFrom(Position position, BigDecimal price, BigDecimal trailFraction) {
        BigDecimal factor = position.getDirection() == PositionDirection.LONG
                ? BigDecimal.ONE.subtract(trailFraction)
                : BigDecimal.ONE.add(trailFraction);
        return price.multiply(factor);
    }

    private PositionEvent event(PositionEventType type, Position position, BigDecimal price,
                                BigDecimal closedValue, BigDecimal pnl, LocalDateTime at) {
        return PositionEvent.builder()
                .type(type)
                .positionId(position.getId())
                .symbol(position.getSymbol())
                .status(position.getStatus())
                .price(price)
                .realizedAmount(closedValue)
                .realizedPnl(pnl)
                .remainingPositionValue(position.remainingPositionValue())
                .trailingStopPrice(position.getTrailingStopPrice())
                .occurredAt(at)
                .build();
    }

    /**
     * Events collected across several ticks, e.g. for replay in tests or batch feeds.
     */
    public List<PositionEvent> replay(Position position, List<PriceTick> ticks) {
        List<PositionEvent> events = new ArrayList<>();
        for (PriceTick tick : ticks) {
            events.addAll(onPriceUpdate(position, tick));
        }
        return events;
    }
}
