package org.carball.cablesizer.model.sizing;

import org.carball.cablesizer.model.table.SizeTableEntry;

public record ResolvedConductor(double baseAmpacity, double resistance, SizeTableEntry entry) {
}
