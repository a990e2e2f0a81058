package org.carball.cablesizer.model.table;

import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.ConductorSize;

/**
 * One row of an ampacity table. Resistance is in the owning standard's unit
 * (mV/A/m or Ω/1000ft).
 */
public record SizeTableEntry(
        ConductorSize size,
        ConductorMaterial material,
        int temperatureRating,
        double baseAmpacityAmps,
        double resistancePerUnitLength
) {
}
