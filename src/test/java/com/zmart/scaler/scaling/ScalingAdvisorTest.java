package com.zmart.scaler.scaling;

import com.zmart.scaler.config.EngineSettings;
import com.zmart.scaler.exception.InvalidStageException;
import com.zmart.scaler.position.LiquidationPriceCalculator;
import com.zmart.scaler.position.Position;
import com.zmart.scaler.position.PositionDirection;
import com.zmart.scaler.position.PriceTick;
import com.zmart.scaler.position.ProfitThresholdEngine;
import com.zmart.scaler.position.Stage;
import com.zmart.scaler.position.SubsequentTakeProfitPolicy;
import com.zmart.scaler.position.TakeProfitStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ScalingAdvisor.
 */
@DisplayName("ScalingAdvisor Tests")
class ScalingAdvisorTest {

    private static final BigDecimal BANKROLL = new BigDecimal("10000");
    private static final BigDecimal INITIAL_SCORE = new BigDecimal("70");

    private final EngineSettings settings = EngineSettings.defaults();
    private final LiquidationPriceCalculator liquidation = new LiquidationPriceCalculator();
    private final ScalingAdvisor advisor = new ScalingAdvisor(settings, ScalingPlan.defaults(), liquidation);

    private Position position;

    @BeforeEach
    void setUp() {
        // Liquidation estimate 42750
        position = Position.open("BTCUSDT", PositionDirection.LONG, 4, bd("100"), bd("20"), bd("45000"));
    }

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    @Nested
    @DisplayName("Trigger Selection")
    class TriggerTests {

        @Test
        @DisplayName("Should flag EMERGENCY inside the 5% buffer")
        void shouldFlagEmergency() {
            ScalingDecision decision = advisor.evaluate(position, bd("44000"), INITIAL_SCORE, INITIAL_SCORE);

            assertTrue(decision.isShouldScale());
            assertEquals(ScalingTrigger.EMERGENCY, decision.getTrigger());
            assertEquals(2, decision.getNextStageNumber());
            assertThat(decision.getPlannedStage().getLeverage()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Should flag LIQUIDATION_PROXIMITY inside the 10% buffer")
        void shouldFlagLiquidationProximity() {
            ScalingDecision decision = advisor.evaluate(position, bd("46000"), INITIAL_SCORE, INITIAL_SCORE);

            assertTrue(decision.isShouldScale());
            assertEquals(ScalingTrigger.LIQUIDATION_PROXIMITY, decision.getTrigger());
        }

        @Test
        @DisplayName("Should prefer proximity over a better score")
        void shouldPreferProximityOverScore() {
            ScalingDecision decision = advisor.evaluate(position, bd("46000"), bd("95"), INITIAL_SCORE);

            assertEquals(ScalingTrigger.LIQUIDATION_PROXIMITY, decision.getTrigger());
        }

        @Test
        @DisplayName("Should flag BETTER_SCORE only above 1.2x the initial score")
        void shouldFlagBetterScore() {
            ScalingDecision better = advisor.evaluate(position, bd("50000"), bd("85"), INITIAL_SCORE);
            assertTrue(better.isShouldScale());
            assertEquals(ScalingTrigger.BETTER_SCORE, better.getTrigger());

            ScalingDecision equal = advisor.evaluate(position, bd("50000"), bd("84"), INITIAL_SCORE);
            assertFalse(equal.isShouldScale());
            assertEquals(ScalingTrigger.NONE, equal.getTrigger());
        }

        @Test
        @DisplayName("Should not scale a full position")
        void shouldNotScaleFullPosition() {
            position.addStage(bd("200"), bd("10"), bd("44500"))
                    .addStage(bd("400"), bd("5"), bd("44000"))
                    .addStage(bd("800"), bd("2"), bd("43500"));

            ScalingDecision decision = advisor.evaluate(position, bd("44000"), bd("99"), INITIAL_SCORE);

            assertFalse(decision.isShouldScale());
            assertNull(decision.getPlannedStage());
        }

        @Test
        @DisplayName("Should not scale once the position has taken profit")
        void shouldNotScaleAfterTakeProfit() {
            ProfitThresholdEngine thresholds = new ProfitThresholdEngine(settings);
            TakeProfitStateMachine machine =
                    new TakeProfitStateMachine(settings, thresholds, SubsequentTakeProfitPolicy.none());
            machine.onPriceUpdate(position, PriceTick.of("54000"));

            ScalingDecision decision = advisor.evaluate(position, bd("54000"), bd("99"), INITIAL_SCORE);

            assertFalse(decision.isShouldScale());
        }
    }

    @Nested
    @DisplayName("Applying Decisions")
    class ApplyTests {

        @Test
        @DisplayName("Should append the planned stage sized from the bankroll")
        void shouldAppendPlannedStage() {
            ScalingDecision decision = advisor.evaluate(position, bd("46000"), INITIAL_SCORE, INITIAL_SCORE);

            Optional<Stage> added = advisor.applyScaling(position, decision, bd("46000"), BANKROLL);

            assertTrue(added.isPresent());
            assertEquals(2, added.get().getStageNumber());
            assertThat(added.get().getInvestment()).isEqualByComparingTo("200");
            assertThat(added.get().getLeverage()).isEqualByComparingTo("10");
            assertThat(position.totalInvested()).isEqualByComparingTo("300");
        }

        @Test
        @DisplayName("Should do nothing for a hold decision")
        void shouldIgnoreHoldDecision() {
            ScalingDecision decision = advisor.evaluate(position, bd("50000"), INITIAL_SCORE, INITIAL_SCORE);

            assertTrue(advisor.applyScaling(position, decision, bd("50000"), BANKROLL).isEmpty());
            assertEquals(1, position.getStageCount());
        }

        @Test
        @DisplayName("Should refuse a stage above half the bankroll")
        void shouldRefuseOversizedStage() {
            ScalingPlan greedy = new ScalingPlan(List.of(
                    ScalePlanStage.builder().stageNumber(1).bankrollFraction(bd("0.01")).leverage(bd("20")).build(),
                    ScalePlanStage.builder().stageNumber(2).bankrollFraction(bd("0.6")).leverage(bd("2")).build()));
            ScalingAdvisor greedyAdvisor = new ScalingAdvisor(settings, greedy, liquidation);

            ScalingDecision decision = greedyAdvisor.evaluate(position, bd("44000"), INITIAL_SCORE, INITIAL_SCORE);

            assertThrows(InvalidStageException.class,
                    () -> greedyAdvisor.applyScaling(position, decision, bd("44000"), BANKROLL));
            assertEquals(1, position.getStageCount());
        }

        @Test
        @DisplayName("Should refuse a decision made before another stage was added")
        void shouldRefuseStaleDecision() {
            ScalingDecision decision = advisor.evaluate(position, bd("44000"), INITIAL_SCORE, INITIAL_SCORE);
            assertEquals(2, decision.getNextStageNumber());

            position.addStage(bd("200"), bd("10"), bd("44000"));

            assertThrows(InvalidStageException.class,
                    () -> advisor.applyScaling(position, decision, bd("44000"), BANKROLL));
            assertEquals(2, position.getStageCount());
            assertThat(position.totalInvested()).isEqualByComparingTo("300");
        }
    }

    @Nested
    @DisplayName("Liquidation Prevention Margin")
    class MarginTests {

        @Test
        @DisplayName("Should not add margin outside the emergency buffer")
        void shouldNotAddMarginWhenFarFromLiquidation() {
            // 3250 / 46000 above 5%
            Optional<BigDecimal> added = advisor.addMargin(position, bd("46000"), BANKROLL);

            assertTrue(added.isEmpty());
            assertThat(position.getAdditionalMargin()).isEqualByComparingTo("0");
            assertThat(liquidation.estimate(position)).isEqualByComparingTo("42750");
        }

        @Test
        @DisplayName("Should add the total invested as margin and push liquidation away")
        void shouldAddTotalInvested() {
            Optional<BigDecimal> added = advisor.addMargin(position, bd("44000"), BANKROLL);

            assertTrue(added.isPresent());
            assertThat(added.get()).isEqualByComparingTo("100");
            assertThat(position.getAdditionalMargin()).isEqualByComparingTo("100");
            assertEquals("Liquidation prevention", position.getMarginAddReason());
            assertNotNull(position.getMarginAddedAt());
            // 45000 x (1 - 200/2000)
            assertThat(liquidation.estimate(position)).isEqualByComparingTo("40500");
        }

        @Test
        @DisplayName("Should cap margin at 30% of the bankroll")
        void shouldCapMarginAtBankrollShare() {
            Optional<BigDecimal> added = advisor.addMargin(position, bd("44000"), bd("200"));

            assertThat(added.orElseThrow()).isEqualByComparingTo("60");
            // 45000 x (1 - 160/2000)
            assertThat(liquidation.estimate(position)).isEqualByComparingTo("41400");
        }

        @Test
        @DisplayName("Should still add margin once every stage is used")
        void shouldAddMarginToFullPosition() {
            position.addStage(bd("200"), bd("10"), bd("44500"))
                    .addStage(bd("400"), bd("5"), bd("44000"))
                    .addStage(bd("800"), bd("2"), bd("43500"));
            assertFalse(advisor.evaluate(position, bd("37000"), INITIAL_SCORE, INITIAL_SCORE).isShouldScale());

            Optional<BigDecimal> added = advisor.addMargin(position, bd("37000"), BANKROLL);

            assertThat(added.orElseThrow()).isEqualByComparingTo("1500");
            assertThat(liquidation.distanceFraction(position, bd("37000"))).isGreaterThan(settings.getEmergencyBuffer());
        }
    }
}
