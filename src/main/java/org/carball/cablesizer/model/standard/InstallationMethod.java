package org.carball.cablesizer.model.standard;

public enum InstallationMethod {
    SINGLE_CONDUIT("single-conduit", IecReferenceMethod.B),
    MULTI_CONDUIT("multi-conduit", IecReferenceMethod.A),
    TRAY("tray", IecReferenceMethod.C),
    DIRECT_BURIED("direct-buried", IecReferenceMethod.C),
    FREE_AIR("free-air", IecReferenceMethod.E);

    private final String label;
    private final IecReferenceMethod iecMethod;

    InstallationMethod(String label, IecReferenceMethod iecMethod) {
        this.label = label;
        this.iecMethod = iecMethod;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Column of IEC 60364-5-52 Table B.52.17 used for this installation.
     */
    public IecReferenceMethod getIecMethod() {
        return iecMethod;
    }

    public static InstallationMethod fromName(String name) {
        String normalized = name.trim().toLowerCase().replace('_', '-');
        switch (normalized) {
            case "single-conduit":
            case "conduit":
            case "conduit-single":
                return SINGLE_CONDUIT;
            case "multi-conduit":
            case "conduit-multiple":
                return MULTI_CONDUIT;
            case "tray":
            case "cable-tray":
                return TRAY;
            case "direct-buried":
            case "direct-burial":
            case "buried":
                return DIRECT_BURIED;
            case "free-air":
            case "air":
                return FREE_AIR;
            default:
                throw new IllegalArgumentException("Unknown installation method: " + name +
                        ". Use single-conduit, multi-conduit, tray, direct-buried or free-air");
        }
    }
}
