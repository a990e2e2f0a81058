package org.carball.cablesizer.engine;

import org.carball.cablesizer.model.sizing.VoltageDrop;
import org.carball.cablesizer.model.standard.CircuitType;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.ConductorSize;
import org.carball.cablesizer.model.standard.Length;
import org.carball.cablesizer.model.standard.Standard;
import org.carball.cablesizer.tables.StandardTables;

/**
 * Voltage drop from tabulated resistance:
 * {@code volts = multiplier x current x length x resistance / 1000}.
 * Lengths must already be in the standard's native unit.
 */
public class VoltageDropCalculator {

    private final StandardTables tables;

    public VoltageDropCalculator(StandardTables tables) {
        this.tables = tables;
    }

    public VoltageDrop drop(double current, Length length, ConductorSize size, ConductorMaterial material,
                            CircuitType circuitType, Standard standard, Double systemVoltage) {
        return drop(current, length, resistanceOf(size, material, standard), circuitType, standard, systemVoltage);
    }

    /**
     * Same as {@link #drop(double, Length, ConductorSize, ConductorMaterial, CircuitType, Standard, Double)}
     * with a caller-supplied resistance in the standard's unit.
     */
    public VoltageDrop drop(double current, Length length, double resistance,
                            CircuitType circuitType, Standard standard, Double systemVoltage) {
        requireNativeUnit(length, standard);
        if (systemVoltage != null && systemVoltage <= 0) {
            throw new IllegalArgumentException("System voltage must be positive: " + systemVoltage);
        }

        double multiplier = circuitType.getVoltageDropMultiplier();
        double volts = multiplier * current * length.value() * resistance / 1000;
        Double percent = systemVoltage != null ? 100 * volts / systemVoltage : null;

        return new VoltageDrop(volts, percent, resistance, standard.getResistanceUnit(), multiplier);
    }

    /**
     * Longest run of the given size that stays within {@code limitPercent}.
     */
    public Length maximumLength(double current, ConductorSize size, ConductorMaterial material,
                                CircuitType circuitType, Standard standard, double systemVoltage,
                                double limitPercent) {
        if (current <= 0) {
            throw new IllegalArgumentException("Current must be positive: " + current);
        }
        double resistance = resistanceOf(size, material, standard);
        double allowedVolts = limitPercent / 100 * systemVoltage;
        double length = allowedVolts * 1000 / (circuitType.getVoltageDropMultiplier() * current * resistance);
        return new Length(length, standard.getLengthUnit());
    }

    /**
     * A drop is a violation only when strictly above the limit.
     */
    public static boolean exceedsLimit(double percent, double limitPercent) {
        return percent > limitPercent;
    }

    private double resistanceOf(ConductorSize size, ConductorMaterial material, Standard standard) {
        if (size.standard() != standard) {
            throw new LookupException(standard, String.format(
                    "Size %s is not a %s conductor size", size.formatted(), standard.getCode()));
        }
        return tables.resistance(standard, material, size)
                .orElseThrow(() -> new LookupException(standard, String.format(
                        "No %s resistance for %s %s", standard.getCode(),
                        material.getDisplayName().toLowerCase(), size.formatted())));
    }

    private static void requireNativeUnit(Length length, Standard standard) {
        if (!length.isIn(standard.getLengthUnit())) {
            throw new IllegalArgumentException(String.format(
                    "%s voltage drop requires length in %s, got %s",
                    standard.getCode(), standard.getLengthUnit().getSymbol(), length));
        }
    }
}
