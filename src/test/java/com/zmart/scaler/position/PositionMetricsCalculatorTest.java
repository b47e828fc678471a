package com.zmart.scaler.position;

import com.zmart.scaler.config.EngineSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.zmart.scaler.position.PositionFixtures.bd;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PositionMetricsCalculator.
 */
@DisplayName("PositionMetricsCalculator Tests")
class PositionMetricsCalculatorTest {

    private final EngineSettings settings = EngineSettings.defaults();
    private final PositionMetricsCalculator calculator = new PositionMetricsCalculator(
            settings, new ProfitThresholdEngine(settings), new LiquidationPriceCalculator());

    @Test
    @DisplayName("Should bundle totals, thresholds and exit amounts")
    void shouldBundleFigures() {
        PositionMetrics metrics = calculator.calculate(PositionFixtures.fourStageLong(), bd("51000"));

        assertEquals(4, metrics.getStageCount());
        assertEquals(PositionStatus.ACCUMULATING, metrics.getStatus());
        assertThat(metrics.getTotalInvested()).isEqualByComparingTo("1500");
        assertThat(metrics.getTotalPositionValue()).isEqualByComparingTo("7600");
        assertThat(metrics.getProfitThreshold()).isEqualByComparingTo("1125");
        assertThat(metrics.getFirstTakeProfitTrigger()).isEqualByComparingTo("2625");
        assertThat(metrics.getCurrentMargin()).isCloseTo(bd("2651.52"), within(bd("0.01")));
        assertTrue(metrics.isFirstTakeProfitReached());

        assertThat(metrics.getFirstTakeAmount()).isEqualByComparingTo("2280");
        assertThat(metrics.getSecondTakeAmount()).isEqualByComparingTo("1900");
        assertThat(metrics.getFinalTakeAmount()).isEqualByComparingTo("3420");
    }

    @Test
    @DisplayName("Should report risk figures")
    void shouldReportRiskFigures() {
        Position position = PositionFixtures.fourStageLong();
        PositionMetrics metrics = calculator.calculate(position, bd("46000"));

        assertThat(metrics.getMaxLoss()).isEqualByComparingTo("1500");
        assertThat(metrics.getBreakEvenPrice()).isEqualByComparingTo(position.weightedAverageEntryPrice());
        assertThat(metrics.getRiskRewardRatio()).isEqualByComparingTo("0.75");
        assertThat(metrics.getLiquidationPrice()).isCloseTo(bd("35548.13"), within(bd("0.01")));
        assertThat(metrics.getLiquidationDistance()).isPositive();
        assertFalse(metrics.isFirstTakeProfitReached());
        assertNull(metrics.getTrailingStopPrice());
    }
}
