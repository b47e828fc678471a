package com.zmart.scaler.service;

import com.zmart.scaler.config.EngineSettings;
import com.zmart.scaler.exception.EngineException;
import com.zmart.scaler.exception.InvalidTransitionException;
import com.zmart.scaler.position.Position;
import com.zmart.scaler.position.PositionDirection;
import com.zmart.scaler.position.PositionEvent;
import com.zmart.scaler.position.PositionStatus;
import com.zmart.scaler.position.PriceTick;
import com.zmart.scaler.position.TakeProfitStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open positions keyed by symbol, at most one per symbol.
 *
 * Every command on a position runs while holding that position's monitor, so stage appends
 * and price ticks for one symbol are serialized while different symbols proceed in parallel.
 * Closed positions are moved to an archive holding the most recent {@code archiveSize} of them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PositionBook {

    private final EngineSettings settings;
    private final TakeProfitStateMachine stateMachine;
    private final List<PositionEventListener> listeners;

    private final Map<String, Position> active = new ConcurrentHashMap<>();
    // Guarded by itself
    private final Deque<Position> archive = new ArrayDeque<>();

    /**
     * Open a position with its first stage.
     *
     * @throws InvalidTransitionException if the symbol already has an open position
     */
    public Position open(String symbol, PositionDirection direction,
                         BigDecimal investment, BigDecimal leverage, BigDecimal entryPrice) {
        try {
            Position position = active.compute(symbol, (key, existing) -> {
                if (existing != null) {
                    throw new InvalidTransitionException(existing.getStatus(),
                            "Position already open for " + key);
                }
                return Position.open(key, direction, settings.getMaxStages(), investment, leverage, entryPrice);
            });
            log.info("Opened {} {}: investment={}, leverage={}x, entry={}",
                    direction, symbol, investment, leverage, entryPrice);
            return position;
        } catch (EngineException e) {
            log.warn("Open rejected for {}: {}", symbol, e.getMessage());
            throw e;
        }
    }

    /**
     * Append a stage to the open position for a symbol.
     */
    public Position addStage(String symbol, BigDecimal investment, BigDecimal leverage, BigDecimal entryPrice) {
        while (true) {
            Position position = require(symbol);
            synchronized (position) {
                if (isReplaced(symbol, position)) {
                    continue;
                }
                try {
                    position.addStage(investment, leverage, entryPrice);
                } catch (EngineException e) {
                    log.warn("Stage rejected for {}: {}", symbol, e.getMessage());
                    throw e;
                }
                log.info("Stage {} added to {}: invested={}, value={}, avg entry={}",
                        position.getStageCount(), symbol, position.totalInvested(),
                        position.totalPositionValue(), position.weightedAverageEntryPrice());
                return position;
            }
        }
    }

    /**
     * Feed a price tick. Ticks for symbols without an open position are ignored.
     *
     * @return events produced by the tick
     */
    public List<PositionEvent> onPriceTick(String symbol, PriceTick tick) {
        while (true) {
            Position position = active.get(symbol);
            if (position == null) {
                log.debug("No open position for {}, tick ignored", symbol);
                return Collections.emptyList();
            }
            synchronized (position) {
                if (isReplaced(symbol, position)) {
                    continue;
                }
                if (position.getStatus() == PositionStatus.CLOSED) {
                    return Collections.emptyList();
                }
                List<PositionEvent> events = stateMachine.onPriceUpdate(position, tick);
                if (position.getStatus() == PositionStatus.CLOSED) {
                    moveToArchive(position);
                }
                events.forEach(this::publish);
                return events;
            }
        }
    }

    /**
     * Close the open position for a symbol at the given price.
     *
     * @throws InvalidTransitionException if the position is already closed
     */
    public PositionEvent close(String symbol, BigDecimal price) {
        while (true) {
            Position position = require(symbol);
            synchronized (position) {
                if (isReplaced(symbol, position)) {
                    continue;
                }
                PositionEvent event;
                try {
                    event = stateMachine.close(position, price, LocalDateTime.now());
                } catch (EngineException e) {
                    log.warn("Close rejected for {}: {}", symbol, e.getMessage());
                    throw e;
                }
                moveToArchive(position);
                publish(event);
                return event;
            }
        }
    }

    public Optional<Position> find(String symbol) {
        return Optional.ofNullable(active.get(symbol));
    }

    public List<Position> activePositions() {
        return new ArrayList<>(active.values());
    }

    /**
     * Most recently closed positions, oldest first.
     */
    public List<Position> archived() {
        synchronized (archive) {
            return new ArrayList<>(archive);
        }
    }

    private Position require(String symbol) {
        Position position = active.get(symbol);
        if (position == null) {
            log.warn("No open position for {}", symbol);
            throw new EngineException("No open position for " + symbol);
        }
        return position;
    }

    // Looked up before the lock was taken; a close and reopen may have happened since
    private boolean isReplaced(String symbol, Position position) {
        if (active.get(symbol) == position) {
            return false;
        }
        log.debug("Position {} for {} was replaced, retrying", position.getId(), symbol);
        return true;
    }

    private void moveToArchive(Position position) {
        active.remove(position.getSymbol(), position);
        synchronized (archive) {
            archive.addLast(position);
            while (archive.size() > settings.getArchiveSize()) {
                Position dropped = archive.removeFirst();
                log.debug("Dropped archived position {} {}", dropped.getSymbol(), dropped.getId());
            }
            log.info("Position {} archived ({} kept)", position.getSymbol(), archive.size());
        }
    }

    // Listener failures are logged; position state stays as committed
    private void publish(PositionEvent event) {
        for (PositionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on {} for {}",
                        listener.getClass().getSimpleName(), event.getType(), event.getSymbol(), e);
            }
        }
    }
}
