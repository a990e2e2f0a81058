package org.carball.cablesizer.model.standard;

import java.util.List;

/**
 * Regulatory framework in force for one sizing request. Selects units,
 * tables and derating rules.
 */
public enum Standard {
    INTERNATIONAL("IEC", "IEC 60364-5-52", LengthUnit.METERS, "mV/A/m", 30, 230),
    NORTH_AMERICAN("NEC", "NEC 2020", LengthUnit.FEET, "Ω/1000ft", 30, 120);

    private final String code;
    private final String displayName;
    private final LengthUnit lengthUnit;
    private final String resistanceUnit;
    private final int referenceAmbient;
    private final double nominalVoltage;

    Standard(String code, String displayName, LengthUnit lengthUnit, String resistanceUnit,
             int referenceAmbient, double nominalVoltage) {
        this.code = code;
        this.displayName = displayName;
        this.lengthUnit = lengthUnit;
        this.resistanceUnit = resistanceUnit;
        this.referenceAmbient = referenceAmbient;
        this.nominalVoltage = nominalVoltage;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Native run-length unit; voltage drop tables are expressed per this unit.
     */
    public LengthUnit getLengthUnit() {
        return lengthUnit;
    }

    public String getResistanceUnit() {
        return resistanceUnit;
    }

    public int getReferenceAmbient() {
        return referenceAmbient;
    }

    public double getNominalVoltage() {
        return nominalVoltage;
    }

    /**
     * Legal conductor sizes, smallest first.
     */
    public List<ConductorSize> sizes() {
        return switch (this) {
            case INTERNATIONAL -> List.<ConductorSize>of(MetricSize.values());
            case NORTH_AMERICAN -> List.<ConductorSize>of(AwgSize.values());
        };
    }

    public ConductorSize parseSize(String designation) {
        return switch (this) {
            case INTERNATIONAL -> MetricSize.fromDesignation(designation);
            case NORTH_AMERICAN -> AwgSize.fromDesignation(designation);
        };
    }

    public static Standard fromName(String name) {
        String normalized = name.trim().toUpperCase();
        switch (normalized) {
            case "IEC":
            case "INTERNATIONAL":
                return INTERNATIONAL;
            case "NEC":
            case "NORTH_AMERICAN":
            case "NORTH-AMERICAN":
                return NORTH_AMERICAN;
            default:
                throw new IllegalArgumentException("Unknown standard: " + name + ". Use IEC or NEC");
        }
    }
}
