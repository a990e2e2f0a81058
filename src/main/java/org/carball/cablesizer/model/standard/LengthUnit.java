package org.carball.cablesizer.model.standard;

public enum LengthUnit {
    METERS("m", 1.0),
    FEET("ft", 0.3048);

    private final String symbol;
    private final double metersPerUnit;

    LengthUnit(String symbol, double metersPerUnit) {
        this.symbol = symbol;
        this.metersPerUnit = metersPerUnit;
    }

    public String getSymbol() {
        return symbol;
    }

    public double getMetersPerUnit() {
        return metersPerUnit;
    }

    public static LengthUnit fromName(String name) {
        String normalized = name.trim().toLowerCase();
        switch (normalized) {
            case "m":
            case "meter":
            case "meters":
            case "metre":
            case "metres":
                return METERS;
            case "ft":
            case "foot":
            case "feet":
                return FEET;
            default:
                throw new IllegalArgumentException("Unknown length unit: " + name + ". Use m or ft");
        }
    }
}
