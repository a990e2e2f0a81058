package org.carball.cablesizer.model.standard;

/**
 * Reference installation methods of IEC 60364-5-52 used as grouping table columns.
 */
public enum IecReferenceMethod {
    A("Method A", "enclosed in conduit in thermally insulated wall"),
    B("Method B", "enclosed in conduit on a wall"),
    C("Method C", "clipped direct"),
    E("Method E", "in free air");

    private final String label;
    private final String description;

    IecReferenceMethod(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }
}
