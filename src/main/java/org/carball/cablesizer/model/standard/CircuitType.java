package org.carball.cablesizer.model.standard;

/**
 * Circuit topology. DC circuits are sized as {@link #SINGLE_PHASE} since the
 * current flows out and back along two conductors.
 */
public enum CircuitType {
    SINGLE_PHASE("single-phase", 2.0),
    THREE_PHASE("three-phase", Math.sqrt(3));

    private final String label;
    private final double voltageDropMultiplier;

    CircuitType(String label, double voltageDropMultiplier) {
        this.label = label;
        this.voltageDropMultiplier = voltageDropMultiplier;
    }

    public String getLabel() {
        return label;
    }

    public double getVoltageDropMultiplier() {
        return voltageDropMultiplier;
    }

    public static CircuitType fromName(String name) {
        String normalized = name.trim().toLowerCase().replace('_', '-');
        switch (normalized) {
            case "single-phase":
            case "single":
            case "1-phase":
            case "dc":
                return SINGLE_PHASE;
            case "three-phase":
            case "three":
            case "3-phase":
                return THREE_PHASE;
            default:
                throw new IllegalArgumentException("Unknown circuit type: " + name + ". Use single-phase, three-phase or dc");
        }
    }
}
