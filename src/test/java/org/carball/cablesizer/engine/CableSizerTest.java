package org.carball.cablesizer.engine;

import org.carball.cablesizer.config.SizingThresholds;
import org.carball.cablesizer.model.sizing.CableSizingInput;
import org.carball.cablesizer.model.sizing.CableSizingResult;
import org.carball.cablesizer.model.sizing.SizingOutcome;
import org.carball.cablesizer.model.standard.Length;
import org.carball.cablesizer.model.standard.LengthUnit;
import org.carball.cablesizer.model.standard.Standard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class CableSizerTest {

    private CableSizer sizer;

    @BeforeEach
    void setUp() {
        sizer = new CableSizer(SizingThresholds.defaults());
    }

    private static CableSizingInput.CableSizingInputBuilder necCircuit() {
        return CableSizingInput.builder()
                .standard(Standard.NORTH_AMERICAN)
                .current(30)
                .length(Length.feet(100))
                .systemVoltage(120)
                .insulationRating(75);
    }

    @Test
    void shouldSizeValidCircuit() {
        // When
        SizingOutcome outcome = sizer.size("kitchen", necCircuit().build());

        // Then
        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.circuitName()).isEqualTo("kitchen");
        assertThat(outcome.error()).isNull();
        assertThat(outcome.validation().valid()).isTrue();
        assertThat(outcome.result().recommendedSize().formatted()).isEqualTo("6 AWG");
    }

    @Test
    void shouldConvertMetersForNecCircuit() {
        // When
        SizingOutcome outcome = sizer.size("converted", necCircuit().length(Length.meters(30.48)).build());

        // Then
        assertThat(outcome.input().getLength().unit()).isEqualTo(LengthUnit.FEET);
        assertThat(outcome.input().getLength().value()).isCloseTo(100.0, within(1e-9));
        assertThat(outcome.result().recommendedSize().formatted()).isEqualTo("6 AWG");
    }

    @Test
    void shouldMapEquivalentInsulationRating() {
        // When
        SizingOutcome outcome = sizer.size("iec", CableSizingInput.builder()
                .standard(Standard.INTERNATIONAL)
                .current(30)
                .length(Length.meters(50))
                .systemVoltage(230)
                .insulationRating(75)
                .build());

        // Then
        assertThat(outcome.input().getInsulationRating()).isEqualTo(70);
        assertThat(outcome.result().recommendedSize().formatted()).isEqualTo("10 mm²");
    }

    @Test
    void shouldReportValidationErrorsWithoutSizing() {
        // When
        SizingOutcome outcome = sizer.size("bad", necCircuit().current(0).build());

        // Then
        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.validation().errors()).containsExactly("Current must be at least 0.1A");
        assertThat(outcome.error()).isEqualTo("Current must be at least 0.1A");
        assertThat(sizer.getCache().size()).isZero();
    }

    @Test
    void shouldNotSizeCircuitWithNonNumericCurrent() {
        // When
        SizingOutcome outcome = sizer.size("nan", CableSizingInput.builder()
                .standard(Standard.INTERNATIONAL)
                .current(Double.NaN)
                .length(Length.meters(50))
                .systemVoltage(230)
                .insulationRating(70)
                .build());

        // Then
        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.validation().valid()).isFalse();
        assertThat(outcome.error()).isEqualTo("Current must be a number");
        assertThat(sizer.getCache().size()).isZero();
    }

    @Test
    void shouldReportLookupFailureAsOutcome() {
        // When
        SizingOutcome outcome = sizer.size("crowded", necCircuit().conductorCount(45).build());

        // Then
        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.validation().valid()).isTrue();
        assertThat(outcome.error()).contains("No NEC adjustment factor for 45");
    }

    @Test
    void shouldSizeCrowdedNecCircuitWithExtendedTable() {
        // Given
        CableSizer extended = new CableSizer(SizingThresholds.builder().extendedGroupingTable(true).build());

        // When
        SizingOutcome outcome = extended.size("crowded", necCircuit().conductorCount(45).build());

        // Then
        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.result().deratingFactors().groupingFactor()).isEqualTo(0.35);
    }

    @Test
    void shouldServeRepeatedInputFromCache() {
        // Given
        CableSizingInput input = necCircuit().build();

        // When
        CableSizingResult first = sizer.selectConductor(input);
        CableSizingResult second = sizer.selectConductor(input);

        // Then
        assertThat(second).isSameAs(first);
        assertThat(sizer.getCache().stats().hitCount()).isEqualTo(1);
        assertThat(sizer.getCache().stats().missCount()).isEqualTo(1);
    }
}
