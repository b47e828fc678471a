package com.zmart.scaler.position;

import com.zmart.scaler.exception.InvalidStageException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered record of the stages committed into one position.
 *
 * Totals and the weighted average entry price are derived from the stage list.
 * They are cached after the first read and the cache is dropped on every append.
 */
@Slf4j
public class StageLedger {

    static final MathContext MC = new MathContext(18, RoundingMode.HALF_UP);

    private final int maxStages;
    private final List<Stage> stages = new ArrayList<>();

    // Derived caches, null = stale
    private BigDecimal totalInvested;
    private BigDecimal totalPositionValue;
    private BigDecimal weightedAverageEntryPrice;

    public StageLedger(int maxStages) {
        if (maxStages < 1) {
            throw new IllegalArgumentException("maxStages must be at least 1, was " + maxStages);
        }
        this.maxStages = maxStages;
    }

    /**
     * Append a stage. Identical arguments on two calls produce two stages.
     *
     * @throws InvalidStageException if an input is not positive or the ledger is full;
     *                               the ledger is left untouched
     */
    public Stage append(BigDecimal investment, BigDecimal leverage, BigDecimal entryPrice) {
        requirePositive("investment", investment);
        requirePositive("leverage", leverage);
        requirePositive("entryPrice", entryPrice);

        if (stages.size() >= maxStages) {
            throw new InvalidStageException(
                    "Maximum stage count reached: " + stages.size() + "/" + maxStages);
        }

        Stage stage = Stage.builder()
                .stageNumber(stages.size() + 1)
                .investment(investment)
                .leverage(leverage)
                .entryPrice(entryPrice)
                .openedAt(LocalDateTime.now())
                .build();

        stages.add(stage);
        invalidate();

        log.debug("Stage {} appended: investment={}, leverage={}x, entry={}",
                stage.getStageNumber(), investment, leverage, entryPrice);
        return stage;
    }

    /**
     * Sum of investments across all stages.
     */
    public BigDecimal totalInvested() {
        if (totalInvested == null) {
            totalInvested = stages.stream()
                    .map(Stage::getInvestment)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
        }
        return totalInvested;
    }

    /**
     * Sum of investment x leverage across all stages.
     */
    public BigDecimal totalPositionValue() {
        if (totalPositionValue == null) {
            totalPositionValue = stages.stream()
                    .map(Stage::getPositionValue)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
        }
        return totalPositionValue;
    }

    /**
     * Position-value-weighted mean of stage entry prices.
     * Zero for an empty ledger.
     */
    public BigDecimal weightedAverageEntryPrice() {
        if (weightedAverageEntryPrice == null) {
            BigDecimal positionValue = totalPositionValue();
            if (positionValue.signum() == 0) {
                return BigDecimal.ZERO;
            }
            BigDecimal weightedSum = stages.stream()
                    .map(s -> s.getEntryPrice().multiply(s.getPositionValue()))
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            weightedAverageEntryPrice = weightedSum.divide(positionValue, MC);
        }
        return weightedAverageEntryPrice;
    }

    public List<Stage> getStages() {
        return Collections.unmodifiableList(new ArrayList<>(stages));
    }

    public Stage getLastStage() {
        return stages.isEmpty() ? null : stages.get(stages.size() - 1);
    }

    public int size() {
        return stages.size();
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }

    public boolean isFull() {
        return stages.size() >= maxStages;
    }

    public int getMaxStages() {
        return maxStages;
    }

    private void invalidate() {
        totalInvested = null;
        totalPositionValue = null;
        weightedAverageEntryPrice = null;
    }

    private static void requirePositive(String name, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new InvalidStageException(name + " must be positive, was " + value);
        }
    }
}
