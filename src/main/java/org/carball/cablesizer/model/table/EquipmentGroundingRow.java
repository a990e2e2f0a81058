package org.carball.cablesizer.model.table;

import org.carball.cablesizer.model.standard.AwgSize;

/**
 * Row of NEC Table 250.122: minimum equipment grounding conductor for an
 * overcurrent device rating up to {@code ocpdRating} amperes.
 */
public record EquipmentGroundingRow(int ocpdRating, AwgSize copper, AwgSize aluminum) {
}
