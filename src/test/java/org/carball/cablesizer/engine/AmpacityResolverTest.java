package org.carball.cablesizer.engine;

import org.carball.cablesizer.model.sizing.ResolvedConductor;
import org.carball.cablesizer.model.standard.AwgSize;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.MetricSize;
import org.carball.cablesizer.model.standard.Standard;
import org.carball.cablesizer.tables.StandardTables;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AmpacityResolverTest {

    private final AmpacityResolver resolver = new AmpacityResolver(StandardTables.defaults());

    @Test
    void shouldResolveBaseAmpacityAndResistance() {
        // When
        ResolvedConductor conductor = resolver.resolve(Standard.NORTH_AMERICAN, ConductorMaterial.COPPER, 75, AwgSize.AWG_6);

        // Then
        assertThat(conductor.baseAmpacity()).isEqualTo(65.0);
        assertThat(conductor.resistance()).isEqualTo(0.491);
        assertThat(conductor.entry().size()).isEqualTo(AwgSize.AWG_6);
    }

    @Test
    void shouldResolveIecXlpeColumn() {
        // When
        ResolvedConductor conductor = resolver.resolve(Standard.INTERNATIONAL, ConductorMaterial.COPPER, 90, MetricSize.MM2_10);

        // Then
        assertThat(conductor.baseAmpacity()).isEqualTo(70.0);
        assertThat(conductor.resistance()).isEqualTo(1.83);
    }

    @Test
    void shouldRejectRatingWithoutTable() {
        assertThatThrownBy(() -> resolver.resolve(Standard.INTERNATIONAL, ConductorMaterial.COPPER, 75, MetricSize.MM2_10))
                .isInstanceOf(LookupException.class)
                .hasMessageContaining("No IEC ampacity table")
                .hasMessageContaining("75°C");
    }

    @Test
    void shouldRejectMissingRow() {
        assertThatThrownBy(() -> resolver.resolve(Standard.NORTH_AMERICAN, ConductorMaterial.ALUMINUM, 75, AwgSize.AWG_14))
                .isInstanceOf(LookupException.class)
                .hasMessageContaining("no aluminum row for 14 AWG");
    }

    @Test
    void shouldRejectSizeFromOtherStandard() {
        assertThatThrownBy(() -> resolver.resolve(Standard.NORTH_AMERICAN, ConductorMaterial.COPPER, 75, MetricSize.MM2_10))
                .isInstanceOfSatisfying(LookupException.class,
                        e -> assertThat(e.getStandard()).isEqualTo(Standard.NORTH_AMERICAN));
    }
}
