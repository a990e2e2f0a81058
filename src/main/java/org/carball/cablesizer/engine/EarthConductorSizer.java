package org.carball.cablesizer.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.cablesizer.model.sizing.ProtectiveConductor;
import org.carball.cablesizer.model.standard.AwgSize;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.ConductorSize;
import org.carball.cablesizer.model.standard.MetricSize;
import org.carball.cablesizer.model.standard.Standard;
import org.carball.cablesizer.tables.StandardTables;

import java.util.Locale;

/**
 * Minimum protective earth (IEC 60364-5-54) or equipment grounding conductor
 * (NEC 250.122) for a sized phase conductor.
 */
@Slf4j
public class EarthConductorSizer {

    static final double OCPD_FACTOR = 1.25;

    private final StandardTables tables;

    public EarthConductorSizer(StandardTables tables) {
        this.tables = tables;
    }

    public ProtectiveConductor size(Standard standard, ConductorSize phaseSize, double current,
                                    ConductorMaterial material) {
        if (phaseSize.standard() != standard) {
            throw new LookupException(standard, String.format(
                    "Size %s is not a %s conductor size", phaseSize.formatted(), standard.getCode()));
        }
        return switch (standard) {
            case NORTH_AMERICAN -> equipmentGroundingConductor((AwgSize) phaseSize, current, material);
            case INTERNATIONAL -> protectiveEarth((MetricSize) phaseSize);
        };
    }

    /**
     * Overcurrent device rating assumed for continuous load: 125% of the load, rounded up.
     */
    public static int ocpdRating(double current) {
        return (int) Math.ceil(OCPD_FACTOR * current);
    }

    private ProtectiveConductor equipmentGroundingConductor(AwgSize phaseSize, double current,
                                                            ConductorMaterial material) {
        int ocpd = ocpdRating(current);
        AwgSize tabulated = tables.equipmentGroundingConductor(ocpd, material)
                .orElseThrow(() -> new LookupException(Standard.NORTH_AMERICAN, String.format(
                        "NEC Table 250.122 has no row for a %d A overcurrent device", ocpd)));

        // 250.122(A): never required larger than the circuit conductors
        AwgSize egc = tabulated.index() > phaseSize.index() ? phaseSize : tabulated;
        String rule = String.format(Locale.ROOT, "OCPD %d A (125%% of %.1f A load)", ocpd, current);
        if (egc != tabulated) {
            rule += ", limited to the phase conductor size";
        }

        log.debug("Equipment grounding conductor for {} {}: {}", phaseSize.formatted(), rule, egc.formatted());
        return new ProtectiveConductor(egc.designation(), egc.formatted(), rule, "NEC 2020 Table 250.122");
    }

    private ProtectiveConductor protectiveEarth(MetricSize phaseSize) {
        double phase = phaseSize.getCrossSection();
        double required;
        String rule;
        if (phase <= 16) {
            required = phase;
            rule = "S ≤ 16 mm²: PE = S";
        } else if (phase <= 35) {
            required = 16;
            rule = "16 < S ≤ 35 mm²: PE = 16 mm²";
        } else {
            required = phase / 2;
            rule = "S > 35 mm²: PE = S/2";
        }

        double minimum = tables.minimumProtectiveConductor();
        if (required < minimum) {
            required = minimum;
            rule += ", minimum 2.5 mm² for a separate conductor";
        }

        MetricSize pe = MetricSize.ceiling(required);
        log.debug("Protective earth for {}: {}", phaseSize.formatted(), pe.formatted());
        return new ProtectiveConductor(pe.designation(), pe.formatted(), rule, "IEC 60364-5-54 Table 54.2");
    }
}
