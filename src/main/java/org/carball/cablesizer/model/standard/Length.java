package org.carball.cablesizer.model.standard;

import java.util.Locale;

/**
 * One-way run length tagged with its unit. Voltage drop is only ever computed
 * from a length expressed in the standard's native unit.
 */
public record Length(double value, LengthUnit unit) {

    public Length {
        if (unit == null) {
            throw new IllegalArgumentException("Length unit is required");
        }
    }

    public static Length meters(double value) {
        return new Length(value, LengthUnit.METERS);
    }

    public static Length feet(double value) {
        return new Length(value, LengthUnit.FEET);
    }

    public Length to(LengthUnit target) {
        if (target == unit) {
            return this;
        }
        double meters = value * unit.getMetersPerUnit();
        return new Length(meters / target.getMetersPerUnit(), target);
    }

    public boolean isIn(LengthUnit candidate) {
        return unit == candidate;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.1f %s", value, unit.getSymbol());
    }
}
