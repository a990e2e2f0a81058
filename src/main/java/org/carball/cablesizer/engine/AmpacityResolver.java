package org.carball.cablesizer.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.cablesizer.model.sizing.ResolvedConductor;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.ConductorSize;
import org.carball.cablesizer.model.standard.Standard;
import org.carball.cablesizer.model.table.SizeTableEntry;
import org.carball.cablesizer.tables.StandardTables;

/**
 * Exact-match lookup of base ampacity and resistance. Never interpolates
 * between ratings or sizes.
 */
@Slf4j
public class AmpacityResolver {

    private final StandardTables tables;

    public AmpacityResolver(StandardTables tables) {
        this.tables = tables;
    }

    public ResolvedConductor resolve(Standard standard, ConductorMaterial material,
                                     int insulationRating, ConductorSize size) {
        if (size.standard() != standard) {
            throw new LookupException(standard, String.format(
                    "Size %s is not a %s conductor size", size.formatted(), standard.getCode()));
        }

        if (!tables.hasTable(standard, material, insulationRating)) {
            throw new LookupException(standard, String.format(
                    "No %s ampacity table for %s at %d°C insulation (tabulated ratings: %s)",
                    standard.getCode(), material.getDisplayName().toLowerCase(), insulationRating,
                    tables.ratings(standard)));
        }

        SizeTableEntry entry = tables.entry(standard, material, insulationRating, size)
                .orElseThrow(() -> new LookupException(standard, String.format(
                        "%s ampacity table has no %s row for %s",
                        standard.getCode(), material.getDisplayName().toLowerCase(), size.formatted())));

        log.trace("Resolved {} {} at {}°C: {} A, {} {}", standard.getCode(), size.formatted(),
                insulationRating, entry.baseAmpacityAmps(), entry.resistancePerUnitLength(),
                standard.getResistanceUnit());

        return new ResolvedConductor(entry.baseAmpacityAmps(), entry.resistancePerUnitLength(), entry);
    }
}
