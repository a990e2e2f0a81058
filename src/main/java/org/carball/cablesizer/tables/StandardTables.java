package org.carball.cablesizer.tables;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.cablesizer.model.standard.AwgSize;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.ConductorSize;
import org.carball.cablesizer.model.standard.Standard;
import org.carball.cablesizer.model.table.EquipmentGroundingRow;
import org.carball.cablesizer.model.table.GroupingBucket;
import org.carball.cablesizer.model.table.IecGroupingRow;
import org.carball.cablesizer.model.table.SizeTableEntry;
import org.carball.cablesizer.model.table.TemperatureBucket;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable lookup data for both standards. Built once and shared; every
 * accessor is a pure read.
 */
@Slf4j
public final class StandardTables {

    private static final StandardTables DEFAULTS = new StandardTables(false);
    private static final StandardTables EXTENDED = new StandardTables(true);

    private final Map<TableKey, SizeTableEntry[]> ampacityTables;
    private final List<GroupingBucket> necGrouping;

    @Getter
    private final boolean extendedGrouping;

    private StandardTables(boolean extendedGrouping) {
        this.extendedGrouping = extendedGrouping;
        this.ampacityTables = buildAmpacityTables();

        List<GroupingBucket> grouping = new ArrayList<>(NecTableData.GROUPING);
        if (extendedGrouping) {
            grouping.add(NecTableData.EXTENDED_GROUPING);
        }
        this.necGrouping = Collections.unmodifiableList(grouping);

        log.debug("Built standard tables: {} ampacity tables, extended grouping {}",
                ampacityTables.size(), extendedGrouping ? "enabled" : "disabled");
    }

    public static StandardTables defaults() {
        return DEFAULTS;
    }

    public static StandardTables withExtendedGrouping() {
        return EXTENDED;
    }

    public static StandardTables forConfiguration(boolean extendedGrouping) {
        return extendedGrouping ? EXTENDED : DEFAULTS;
    }

    public List<ConductorSize> sizes(Standard standard) {
        return standard.sizes();
    }

    /**
     * Insulation ratings with a tabulated ampacity column.
     */
    public Set<Integer> ratings(Standard standard) {
        int[] ratings = switch (standard) {
            case INTERNATIONAL -> IecTableData.RATINGS;
            case NORTH_AMERICAN -> NecTableData.RATINGS;
        };
        Set<Integer> result = new TreeSet<>();
        for (int rating : ratings) {
            result.add(rating);
        }
        return Collections.unmodifiableSet(result);
    }

    public boolean hasTable(Standard standard, ConductorMaterial material, int insulationRating) {
        return ampacityTables.containsKey(new TableKey(standard, material, insulationRating));
    }

    /**
     * Row for an exact (standard, material, rating, size) tuple. Empty when the
     * table or the row does not exist.
     */
    public Optional<SizeTableEntry> entry(Standard standard, ConductorMaterial material,
                                          int insulationRating, ConductorSize size) {
        SizeTableEntry[] table = ampacityTables.get(new TableKey(standard, material, insulationRating));
        if (table == null || size.standard() != standard) {
            return Optional.empty();
        }
        return Optional.ofNullable(table[size.index()]);
    }

    /**
     * Per-unit-length resistance of a size. It does not depend on the
     * insulation column, so the lowest rating's row is used.
     */
    public Optional<Double> resistance(Standard standard, ConductorMaterial material, ConductorSize size) {
        int rating = ratings(standard).iterator().next();
        return entry(standard, material, rating, size).map(SizeTableEntry::resistancePerUnitLength);
    }

    public List<TemperatureBucket> temperatureBuckets(Standard standard) {
        return switch (standard) {
            case INTERNATIONAL -> IecTableData.TEMPERATURE;
            case NORTH_AMERICAN -> NecTableData.TEMPERATURE;
        };
    }

    public double minimumAmbient(Standard standard) {
        return switch (standard) {
            case INTERNATIONAL -> IecTableData.MINIMUM_AMBIENT;
            case NORTH_AMERICAN -> NecTableData.MINIMUM_AMBIENT;
        };
    }

    public double maximumAmbient(Standard standard) {
        return switch (standard) {
            case INTERNATIONAL -> IecTableData.MAXIMUM_AMBIENT;
            case NORTH_AMERICAN -> NecTableData.MAXIMUM_AMBIENT;
        };
    }

    public List<GroupingBucket> necGrouping() {
        return necGrouping;
    }

    public List<IecGroupingRow> iecGrouping() {
        return IecTableData.GROUPING;
    }

    public List<EquipmentGroundingRow> equipmentGrounding() {
        return NecTableData.EQUIPMENT_GROUNDING;
    }

    public double minimumProtectiveConductor() {
        return IecTableData.MINIMUM_PROTECTIVE_CONDUCTOR;
    }

    private static Map<TableKey, SizeTableEntry[]> buildAmpacityTables() {
        Map<TableKey, SizeTableEntry[]> tables = new HashMap<>();
        for (Standard standard : Standard.values()) {
            List<ConductorSize> sizes = standard.sizes();
            int[] ratings = switch (standard) {
                case INTERNATIONAL -> IecTableData.RATINGS;
                case NORTH_AMERICAN -> NecTableData.RATINGS;
            };
            for (ConductorMaterial material : ConductorMaterial.values()) {
                double[][] rows = rawRows(standard, material);
                for (int column = 0; column < ratings.length; column++) {
                    SizeTableEntry[] table = new SizeTableEntry[sizes.size()];
                    for (int i = 0; i < rows.length; i++) {
                        double[] row = rows[i];
                        if (row == null) {
                            continue;
                        }
                        table[i] = new SizeTableEntry(sizes.get(i), material, ratings[column],
                                row[column + 1], row[0]);
                    }
                    tables.put(new TableKey(standard, material, ratings[column]), table);
                }
            }
        }
        return Map.copyOf(tables);
    }

    private static double[][] rawRows(Standard standard, ConductorMaterial material) {
        return switch (standard) {
            case INTERNATIONAL -> material == ConductorMaterial.COPPER ? IecTableData.COPPER : IecTableData.ALUMINUM;
            case NORTH_AMERICAN -> material == ConductorMaterial.COPPER ? NecTableData.COPPER : NecTableData.ALUMINUM;
        };
    }

    /**
     * Equipment grounding conductor for the given OCPD rating, empty above the table.
     */
    public Optional<AwgSize> equipmentGroundingConductor(int ocpdRating, ConductorMaterial material) {
        for (EquipmentGroundingRow row : NecTableData.EQUIPMENT_GROUNDING) {
            if (row.ocpdRating() >= ocpdRating) {
                return Optional.of(material == ConductorMaterial.COPPER ? row.copper() : row.aluminum());
            }
        }
        return Optional.empty();
    }

    private record TableKey(Standard standard, ConductorMaterial material, int rating) {
    }
}
