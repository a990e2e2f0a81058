package org.carball.cablesizer.model.sizing;

/**
 * Raw voltage drop for one conductor. {@code percent} is null when no system
 * voltage was supplied.
 */
public record VoltageDrop(
        double volts,
        Double percent,
        double resistance,
        String resistanceUnit,
        double multiplier
) {

    public boolean hasPercent() {
        return percent != null;
    }
}
