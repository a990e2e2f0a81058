package org.carball.cablesizer.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.cablesizer.model.sizing.DeratingFactor;
import org.carball.cablesizer.model.standard.IecReferenceMethod;
import org.carball.cablesizer.model.standard.InstallationMethod;
import org.carball.cablesizer.model.standard.Standard;
import org.carball.cablesizer.model.table.GroupingBucket;
import org.carball.cablesizer.model.table.IecGroupingRow;
import org.carball.cablesizer.model.table.TemperatureBucket;
import org.carball.cablesizer.tables.StandardTables;

/**
 * Combines ambient temperature correction with grouping adjustment. Values
 * outside the tables are rejected rather than clamped.
 */
@Slf4j
public class DeratingComposer {

    static final String NEC_REFERENCE = "NEC 310.15(B)(2)(a), NEC 310.15(C)(1)";
    static final String IEC_REFERENCE = "IEC 60364-5-52 Table B.52.14, Table B.52.17";

    private final StandardTables tables;

    public DeratingComposer(StandardTables tables) {
        this.tables = tables;
    }

    public DeratingFactor compose(Standard standard, double ambientTemperature, int insulationRating,
                                  int conductorCount, InstallationMethod installationMethod) {
        double temperatureFactor = temperatureFactor(standard, ambientTemperature, insulationRating);
        double groupingFactor = switch (standard) {
            case NORTH_AMERICAN -> necGroupingFactor(conductorCount);
            case INTERNATIONAL -> iecGroupingFactor(conductorCount, installationMethod);
        };
        String reference = switch (standard) {
            case NORTH_AMERICAN -> NEC_REFERENCE;
            case INTERNATIONAL -> IEC_REFERENCE;
        };

        double totalFactor = Math.min(1.0, temperatureFactor * groupingFactor);

        log.debug("{} derating at {}°C, {} conductors: temperature {} x grouping {} = {}",
                standard.getCode(), ambientTemperature, conductorCount,
                temperatureFactor, groupingFactor, totalFactor);

        return new DeratingFactor(temperatureFactor, groupingFactor, totalFactor, reference);
    }

    /**
     * Ambient correction for the insulation column, capped at 1.0.
     */
    public double temperatureFactor(Standard standard, double ambientTemperature, int insulationRating) {
        if (ambientTemperature < tables.minimumAmbient(standard)
                || ambientTemperature > tables.maximumAmbient(standard)) {
            throw new LookupException(standard, String.format(
                    "Ambient temperature %s°C is outside the %s correction table (%s to %s°C)",
                    ambientTemperature, standard.getCode(),
                    tables.minimumAmbient(standard), tables.maximumAmbient(standard)));
        }

        TemperatureBucket bucket = tables.temperatureBuckets(standard).stream()
                .filter(b -> b.contains(ambientTemperature))
                .findFirst()
                .orElseThrow(() -> new LookupException(standard, String.format(
                        "No %s temperature correction row for %s°C", standard.getCode(), ambientTemperature)));

        Double factor = bucket.factorFor(insulationRating);
        if (factor == null) {
            throw new LookupException(standard, String.format(
                    "No %s temperature correction column for %d°C insulation",
                    standard.getCode(), insulationRating));
        }
        if (factor <= 0) {
            throw new LookupException(standard, String.format(
                    "Ambient temperature %s°C exceeds the limit for %d°C insulation",
                    ambientTemperature, insulationRating));
        }
        return Math.min(1.0, factor);
    }

    private double necGroupingFactor(int conductorCount) {
        return tables.necGrouping().stream()
                .filter(bucket -> bucket.contains(conductorCount))
                .map(GroupingBucket::factor)
                .findFirst()
                .orElseThrow(() -> new LookupException(Standard.NORTH_AMERICAN, String.format(
                        "No NEC adjustment factor for %d current-carrying conductors%s",
                        conductorCount,
                        conductorCount > 40 && !tables.isExtendedGrouping()
                                ? " (enable the extended grouping table for more than 40)" : "")));
    }

    private double iecGroupingFactor(int conductorCount, InstallationMethod installationMethod) {
        if (conductorCount < 1) {
            throw new LookupException(Standard.INTERNATIONAL,
                    "No IEC grouping factor for " + conductorCount + " conductors");
        }
        int circuits = circuitsFor(conductorCount);
        IecReferenceMethod method = (installationMethod != null ? installationMethod : InstallationMethod.SINGLE_CONDUIT)
                .getIecMethod();

        return tables.iecGrouping().stream()
                .filter(row -> row.circuits() >= circuits)
                .findFirst()
                .map(row -> row.factorFor(method))
                .orElseThrow(() -> new LookupException(Standard.INTERNATIONAL, String.format(
                        "No IEC grouping factor for %d circuits (%d conductors); table ends at %d",
                        circuits, conductorCount, lastRow().circuits())));
    }

    /**
     * Loaded circuits assumed from a conductor count, three conductors per circuit.
     */
    public static int circuitsFor(int conductorCount) {
        return (int) Math.ceil(conductorCount / 3.0);
    }

    private IecGroupingRow lastRow() {
        return tables.iecGrouping().get(tables.iecGrouping().size() - 1);
    }
}
