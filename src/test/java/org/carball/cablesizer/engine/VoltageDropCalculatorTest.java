package org.carball.cablesizer.engine;

import org.carball.cablesizer.model.sizing.VoltageDrop;
import org.carball.cablesizer.model.standard.AwgSize;
import org.carball.cablesizer.model.standard.CircuitType;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.Length;
import org.carball.cablesizer.model.standard.LengthUnit;
import org.carball.cablesizer.model.standard.MetricSize;
import org.carball.cablesizer.model.standard.Standard;
import org.carball.cablesizer.tables.StandardTables;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class VoltageDropCalculatorTest {

    private final VoltageDropCalculator calculator = new VoltageDropCalculator(StandardTables.defaults());

    @Test
    void shouldCalculateSinglePhaseIecDrop() {
        // When
        VoltageDrop drop = calculator.drop(30, Length.meters(50), MetricSize.MM2_6, ConductorMaterial.COPPER,
                CircuitType.SINGLE_PHASE, Standard.INTERNATIONAL, 230.0);

        // Then
        assertThat(drop.volts()).isCloseTo(9.24, within(1e-9));
        assertThat(drop.percent()).isCloseTo(4.017, within(1e-3));
        assertThat(drop.resistanceUnit()).isEqualTo("mV/A/m");
        assertThat(drop.multiplier()).isEqualTo(2.0);
    }

    @Test
    void shouldCalculateThreePhaseIecDrop() {
        // When
        VoltageDrop drop = calculator.drop(50, Length.meters(100), MetricSize.MM2_16, ConductorMaterial.COPPER,
                CircuitType.THREE_PHASE, Standard.INTERNATIONAL, 400.0);

        // Then
        assertThat(drop.volts()).isCloseTo(9.96, within(1e-2));
        assertThat(drop.resistance()).isEqualTo(1.15);
    }

    @Test
    void shouldCalculateThreePhaseDropFromSuppliedResistance() {
        // When
        VoltageDrop drop = calculator.drop(100, Length.meters(100), 0.575, CircuitType.THREE_PHASE,
                Standard.INTERNATIONAL, 400.0);

        // Then
        assertThat(drop.volts()).isCloseTo(9.9593, within(1e-3));
        assertThat(drop.multiplier()).isCloseTo(Math.sqrt(3), within(1e-12));
    }

    @Test
    void shouldCalculateNecDropInFeet() {
        // When
        VoltageDrop drop = calculator.drop(30, Length.feet(100), AwgSize.AWG_10, ConductorMaterial.COPPER,
                CircuitType.SINGLE_PHASE, Standard.NORTH_AMERICAN, 120.0);

        // Then
        assertThat(drop.volts()).isCloseTo(7.44, within(1e-9));
        assertThat(drop.percent()).isCloseTo(6.2, within(1e-9));
        assertThat(drop.resistanceUnit()).isEqualTo("Ω/1000ft");
    }

    @Test
    void shouldOmitPercentWithoutSystemVoltage() {
        // When
        VoltageDrop drop = calculator.drop(30, Length.meters(50), MetricSize.MM2_6, ConductorMaterial.COPPER,
                CircuitType.SINGLE_PHASE, Standard.INTERNATIONAL, null);

        // Then
        assertThat(drop.hasPercent()).isFalse();
        assertThat(drop.volts()).isCloseTo(9.24, within(1e-9));
    }

    @Test
    void shouldRejectLengthInForeignUnit() {
        assertThatThrownBy(() -> calculator.drop(30, Length.meters(30), AwgSize.AWG_10, ConductorMaterial.COPPER,
                CircuitType.SINGLE_PHASE, Standard.NORTH_AMERICAN, 120.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires length in ft");
    }

    @Test
    void shouldRejectNonPositiveVoltage() {
        assertThatThrownBy(() -> calculator.drop(30, Length.meters(50), 3.08, CircuitType.SINGLE_PHASE,
                Standard.INTERNATIONAL, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectMissingResistanceRow() {
        assertThatThrownBy(() -> calculator.drop(10, Length.meters(10), MetricSize.MM2_1_5, ConductorMaterial.ALUMINUM,
                CircuitType.SINGLE_PHASE, Standard.INTERNATIONAL, 230.0))
                .isInstanceOf(LookupException.class);
    }

    @Test
    void shouldCalculateMaximumRunLength() {
        // When
        Length maximum = calculator.maximumLength(30, MetricSize.MM2_10, ConductorMaterial.COPPER,
                CircuitType.SINGLE_PHASE, Standard.INTERNATIONAL, 230, 3.0);

        // Then
        assertThat(maximum.unit()).isEqualTo(LengthUnit.METERS);
        assertThat(maximum.value()).isCloseTo(62.84, within(1e-2));
    }

    @Test
    void shouldTreatDropEqualToLimitAsCompliant() {
        assertThat(VoltageDropCalculator.exceedsLimit(3.0, 3.0)).isFalse();
        assertThat(VoltageDropCalculator.exceedsLimit(3.0000001, 3.0)).isTrue();
    }

    @Test
    void shouldScaleVoltsLinearlyWithCurrentAndLength() {
        // Given
        VoltageDrop base = calculator.drop(20, Length.feet(80), AwgSize.AWG_8, ConductorMaterial.COPPER,
                CircuitType.SINGLE_PHASE, Standard.NORTH_AMERICAN, 240.0);

        // When
        VoltageDrop doubleCurrent = calculator.drop(40, Length.feet(80), AwgSize.AWG_8, ConductorMaterial.COPPER,
                CircuitType.SINGLE_PHASE, Standard.NORTH_AMERICAN, 240.0);
        VoltageDrop tripleLength = calculator.drop(20, Length.feet(240), AwgSize.AWG_8, ConductorMaterial.COPPER,
                CircuitType.SINGLE_PHASE, Standard.NORTH_AMERICAN, 240.0);

        // Then
        assertThat(doubleCurrent.volts()).isCloseTo(2 * base.volts(), within(1e-9));
        assertThat(tripleLength.volts()).isCloseTo(3 * base.volts(), within(1e-9));
    }

    @Test
    void shouldKeepPercentWhenVoltsAndSystemVoltageDouble() {
        // Given
        VoltageDrop base = calculator.drop(25, Length.meters(40), MetricSize.MM2_4, ConductorMaterial.COPPER,
                CircuitType.THREE_PHASE, Standard.INTERNATIONAL, 230.0);

        // When
        VoltageDrop doubled = calculator.drop(50, Length.meters(40), MetricSize.MM2_4, ConductorMaterial.COPPER,
                CircuitType.THREE_PHASE, Standard.INTERNATIONAL, 460.0);

        // Then
        assertThat(doubled.volts()).isCloseTo(2 * base.volts(), within(1e-9));
        assertThat(doubled.percent()).isCloseTo(base.percent(), within(1e-9));
    }
}
