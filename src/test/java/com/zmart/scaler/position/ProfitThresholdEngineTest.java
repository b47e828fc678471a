package com.zmart.scaler.position;

import com.zmart.scaler.config.EngineSettings;
import com.zmart.scaler.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.zmart.scaler.position.PositionFixtures.bd;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ProfitThresholdEngine.
 */
@DisplayName("ProfitThresholdEngine Tests")
class ProfitThresholdEngineTest {

    private static final BigDecimal CENT = bd("0.01");

    private final ProfitThresholdEngine engine = new ProfitThresholdEngine(EngineSettings.defaults());

    @Nested
    @DisplayName("Thresholds")
    class ThresholdTests {

        @Test
        @DisplayName("Should use 75% of invested as threshold and 175% as trigger")
        void shouldComputeThresholdAndTrigger() {
            assertThat(engine.profitThreshold(bd("1500"))).isEqualByComparingTo("1125");
            assertThat(engine.firstTakeProfitTrigger(bd("1500"))).isEqualByComparingTo("2625");
            assertThat(engine.firstTakeProfitTrigger(bd("100"))).isEqualByComparingTo("175");
        }

        @Test
        @DisplayName("Should follow the ledger after every stage append")
        void shouldRecomputeTriggerAfterAppend() {
            Position position = Position.open("ETHUSDT", PositionDirection.LONG, 4, bd("100"), bd("20"), bd("3000"));
            assertThat(engine.firstTakeProfitTrigger(position)).isEqualByComparingTo("175");

            position.addStage(bd("200"), bd("10"), bd("2900"));
            assertThat(engine.firstTakeProfitTrigger(position)).isEqualByComparingTo("525");
        }

        @Test
        @DisplayName("Should honor a configured profit fraction")
        void shouldHonorConfiguredProfitFraction() {
            ProfitThresholdEngine custom = new ProfitThresholdEngine(
                    EngineSettings.builder().profitFraction(bd("0.5")).build());

            assertThat(custom.firstTakeProfitTrigger(bd("1500"))).isEqualByComparingTo("2250");
        }
    }

    @Nested
    @DisplayName("LONG Margin")
    class LongMarginTests {

        private final Position position = PositionFixtures.fourStageLong();

        @Test
        @DisplayName("Should compute margin as invested plus unrealized PnL")
        void shouldComputeMargin() {
            assertThat(engine.currentMargin(position, bd("46000"))).isCloseTo(bd("1793.52"), within(CENT));
            assertThat(engine.currentMargin(position, bd("51000"))).isCloseTo(bd("2651.52"), within(CENT));
            assertThat(engine.currentMargin(position, bd("40000"))).isCloseTo(bd("763.93"), within(CENT));
        }

        @Test
        @DisplayName("Should equal invested at the average entry price")
        void shouldEqualInvestedAtAverageEntry() {
            BigDecimal avg = position.weightedAverageEntryPrice();

            assertThat(engine.currentMargin(position, avg)).isCloseTo(bd("1500"), within(CENT));
            assertThat(engine.unrealizedPnl(position, avg)).isCloseTo(BigDecimal.ZERO, within(CENT));
        }

        @Test
        @DisplayName("Should mark position value at 46000")
        void shouldMarkPositionValue() {
            assertThat(engine.markedPositionValue(position, bd("46000"))).isCloseTo(bd("7893.52"), within(CENT));
        }

        @Test
        @DisplayName("Should reach the first take-profit exactly at the trigger boundary")
        void shouldDetectTriggerBoundary() {
            assertFalse(engine.hasReachedFirstTakeProfit(position, bd("46000")));
            assertFalse(engine.hasReachedFirstTakeProfit(position, bd("50845")));
            assertTrue(engine.hasReachedFirstTakeProfit(position, bd("50846")));
            assertTrue(engine.hasReachedFirstTakeProfit(position, bd("51000")));
        }

        @Test
        @DisplayName("Should report profit as a percentage of invested")
        void shouldReportProfitPercentage() {
            assertThat(engine.profitPercentage(position, bd("51000"))).isEqualByComparingTo("76.77");
            assertThat(engine.profitPercentage(position, bd("40000"))).isEqualByComparingTo("-49.07");
        }
    }

    @Nested
    @DisplayName("SHORT Margin")
    class ShortMarginTests {

        private final Position position = PositionFixtures.fourStage(PositionDirection.SHORT);

        @Test
        @DisplayName("Should mirror the margin formula for SHORT")
        void shouldMirrorMarginForShort() {
            assertThat(engine.currentMargin(position, bd("38000"))).isCloseTo(bd("2579.26"), within(CENT));
            assertThat(engine.currentMargin(position, bd("44000"))).isCloseTo(bd("1549.67"), within(CENT));
        }

        @Test
        @DisplayName("Should reach the trigger when price falls far enough")
        void shouldReachTriggerOnFallingPrice() {
            assertFalse(engine.hasReachedFirstTakeProfit(position, bd("38000")));
            assertTrue(engine.hasReachedFirstTakeProfit(position, bd("37500")));
            assertFalse(engine.hasReachedFirstTakeProfit(position, bd("51000")));
        }
    }

    @Test
    @DisplayName("Should reject a non-positive price naming current_price")
    void shouldRejectInvalidPrice() {
        Position position = PositionFixtures.fourStageLong();

        ValidationException ex = assertThrows(ValidationException.class,
                () -> engine.currentMargin(position, BigDecimal.ZERO));
        assertEquals("current_price", ex.getField());
        assertThrows(ValidationException.class, () -> engine.currentMargin(position, null));
    }
}
