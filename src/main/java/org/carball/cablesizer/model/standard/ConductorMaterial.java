package org.carball.cablesizer.model.standard;

public enum ConductorMaterial {
    COPPER("Copper"),
    ALUMINUM("Aluminum");

    private final String displayName;

    ConductorMaterial(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static ConductorMaterial fromName(String name) {
        String normalized = name.trim().toLowerCase();
        switch (normalized) {
            case "copper":
            case "cu":
                return COPPER;
            case "aluminum":
            case "aluminium":
            case "al":
                return ALUMINUM;
            default:
                throw new IllegalArgumentException("Unknown conductor material: " + name + ". Use copper or aluminum");
        }
    }
}
