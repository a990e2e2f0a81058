package org.carball.cablesizer.engine;

import org.carball.cablesizer.config.SizingThresholds;
import org.carball.cablesizer.model.sizing.CableSizingInput;
import org.carball.cablesizer.model.sizing.CableSizingResult;
import org.carball.cablesizer.model.sizing.RecommendedSize;
import org.carball.cablesizer.model.standard.AwgSize;
import org.carball.cablesizer.model.standard.CircuitType;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.Length;
import org.carball.cablesizer.model.standard.MetricSize;
import org.carball.cablesizer.model.standard.Standard;
import org.carball.cablesizer.tables.StandardTables;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ConductorSelectorTest {

    private final ConductorSelector selector = new ConductorSelector(StandardTables.defaults(), SizingThresholds.defaults());

    private static CableSizingInput.CableSizingInputBuilder iecCircuit() {
        return CableSizingInput.builder()
                .standard(Standard.INTERNATIONAL)
                .current(30)
                .length(Length.meters(50))
                .systemVoltage(230)
                .insulationRating(70);
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
    void shouldUpsizeWhenVoltageDropGovernsIec() {
        // When
        CableSizingResult result = selector.select(iecCircuit().build());

        // Then
        assertThat(result.recommendedSize().formatted()).isEqualTo("10 mm²");
        assertThat(result.recommendedSize().index()).isEqualTo(MetricSize.MM2_10.index());
        assertThat(result.voltageDrop().percent()).isCloseTo(2.387, within(1e-3));
        assertThat(result.voltageDrop().isViolation()).isFalse();
        assertThat(result.ampacity().base()).isEqualTo(54.0);
        assertThat(result.ampacity().utilizationPercent()).isCloseTo(55.56, within(1e-2));
        assertThat(result.compliance().isFullyCompliant()).isTrue();
        assertThat(result.alternativeSizes()).extracting(RecommendedSize::formatted)
                .containsExactly("16 mm²", "25 mm²", "35 mm²");
        assertThat(result.protectiveConductor().formatted()).isEqualTo("10 mm²");
        assertThat(result.standard()).isEqualTo(Standard.INTERNATIONAL);
    }

    @Test
    void shouldSelectSmallestSizeByAmpacityWhenRunIsShort() {
        // When
        CableSizingResult result = selector.select(iecCircuit().length(Length.meters(5)).build());

        // Then
        assertThat(result.recommendedSize().formatted()).isEqualTo("4 mm²");
        assertThat(result.compliance().isFullyCompliant()).isTrue();
    }

    @Test
    void shouldUpsizeWhenVoltageDropGovernsNec() {
        // When
        CableSizingResult result = selector.select(necCircuit().build());

        // Then
        assertThat(result.recommendedSize().formatted()).isEqualTo("6 AWG");
        assertThat(result.voltageDrop().percent()).isCloseTo(2.455, within(1e-3));
        assertThat(result.voltageDrop().resistanceUnit()).isEqualTo("Ω/1000ft");
        assertThat(result.protectiveConductor().formatted()).isEqualTo("10 AWG");
    }

    @Test
    void shouldSkipSizesMissingFromAluminiumTable() {
        // When
        CableSizingResult result = selector.select(necCircuit()
                .material(ConductorMaterial.ALUMINUM)
                .current(10)
                .length(Length.feet(10))
                .build());

        // Then
        assertThat(result.recommendedSize().formatted()).isEqualTo("12 AWG");
        assertThat(result.recommendedSize().index()).isEqualTo(AwgSize.AWG_12.index());
        assertThat(result.voltageDrop().percent()).isCloseTo(0.5417, within(1e-3));
        assertThat(result.warnings()).anyMatch(w -> w.startsWith("Aluminum conductors require anti-oxidant"));
    }

    @Test
    void shouldReportLargestSizeWhenTableIsExhausted() {
        // When
        CableSizingResult result = selector.select(iecCircuit()
                .current(600)
                .length(Length.meters(10))
                .circuitType(CircuitType.THREE_PHASE)
                .systemVoltage(400)
                .build());

        // Then
        assertThat(result.recommendedSize().formatted()).isEqualTo("630 mm²");
        assertThat(result.ampacity().derated()).isEqualTo(560.0);
        assertThat(result.compliance().isAmpacityCompliant()).isFalse();
        assertThat(result.compliance().isVoltageDropCompliant()).isTrue();
        assertThat(result.compliance().isFullyCompliant()).isFalse();
        assertThat(result.voltageDrop().percent()).isCloseTo(0.0735, within(1e-3));
        assertThat(result.alternativeSizes()).isEmpty();
        assertThat(result.warnings()).anyMatch(w -> w.contains("exceeds maximum conductor size"));
    }

    @Test
    void shouldAcceptDropExactlyAtLimit() {
        // Given
        VoltageDropCalculator calculator = new VoltageDropCalculator(StandardTables.defaults());
        double limit = calculator.drop(30, Length.meters(50), MetricSize.MM2_10, ConductorMaterial.COPPER,
                CircuitType.SINGLE_PHASE, Standard.INTERNATIONAL, 230.0).percent();

        // When
        CableSizingResult result = selector.select(iecCircuit().maxVoltageDropPercent(limit).build());

        // Then
        assertThat(result.recommendedSize().formatted()).isEqualTo("10 mm²");
        assertThat(result.voltageDrop().isViolation()).isFalse();
    }

    @Test
    void shouldNeverRecommendSmallerSizeForLargerCurrent() {
        int previous = -1;
        for (int current = 5; current <= 400; current += 5) {
            CableSizingResult result = selector.select(necCircuit().current(current).build());
            assertThat(result.recommendedSize().index()).isGreaterThanOrEqualTo(previous);
            previous = result.recommendedSize().index();
        }
    }

    @Test
    void shouldProduceIdenticalResultsForIdenticalInputs() {
        // Given
        CableSizingInput input = iecCircuit().conductorCount(9).ambientTemperature(40).build();

        // When
        CableSizingResult first = selector.select(input);
        CableSizingResult second = selector.select(input);

        // Then
        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldVerifyExplicitSizeWithoutSearching() {
        // When
        CableSizingResult result = selector.select(iecCircuit().explicitSize(MetricSize.MM2_1_5).build());

        // Then
        assertThat(result.recommendedSize().formatted()).isEqualTo("1.5 mm²");
        assertThat(result.voltageDrop().percent()).isCloseTo(15.78, within(1e-2));
        assertThat(result.voltageDrop().isDangerous()).isTrue();
        assertThat(result.compliance().isAmpacityCompliant()).isFalse();
        assertThat(result.alternativeSizes()).isEmpty();
        assertThat(result.warnings().get(0)).startsWith("Specified size 1.5 mm² does not meet requirements");
    }

    @Test
    void shouldRejectRatingWithoutAnyTable() {
        assertThatThrownBy(() -> selector.select(necCircuit().insulationRating(70).build()))
                .isInstanceOf(LookupException.class);
    }

    @Test
    void shouldLimitAlternativesToConfiguredCount() {
        // Given
        ConductorSelector single = new ConductorSelector(StandardTables.defaults(),
                SizingThresholds.builder().alternativeSizeCount(1).build());

        // When
        CableSizingResult result = single.select(iecCircuit().build());

        // Then
        assertThat(result.alternativeSizes()).extracting(RecommendedSize::formatted).containsExactly("16 mm²");
    }
}
