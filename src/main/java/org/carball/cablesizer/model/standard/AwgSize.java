package org.carball.cablesizer.model.standard;

import java.util.Locale;

public enum AwgSize implements ConductorSize {
    AWG_14("14", false),
    AWG_12("12", false),
    AWG_10("10", false),
    AWG_8("8", false),
    AWG_6("6", false),
    AWG_4("4", false),
    AWG_3("3", false),
    AWG_2("2", false),
    AWG_1("1", false),
    AWG_1_0("1/0", false),
    AWG_2_0("2/0", false),
    AWG_3_0("3/0", false),
    AWG_4_0("4/0", false),
    KCMIL_250("250", true),
    KCMIL_300("300", true),
    KCMIL_350("350", true),
    KCMIL_400("400", true),
    KCMIL_500("500", true),
    KCMIL_600("600", true),
    KCMIL_750("750", true),
    KCMIL_1000("1000", true);

    private final String designation;
    private final boolean kcmil;

    AwgSize(String designation, boolean kcmil) {
        this.designation = designation;
        this.kcmil = kcmil;
    }

    public boolean isKcmil() {
        return kcmil;
    }

    @Override
    public Standard standard() {
        return Standard.NORTH_AMERICAN;
    }

    @Override
    public String designation() {
        return designation;
    }

    @Override
    public String formatted() {
        return designation + (kcmil ? " kcmil" : " AWG");
    }

    @Override
    public int index() {
        return ordinal();
    }

    public static AwgSize fromDesignation(String designation) {
        String normalized = designation.trim().toLowerCase(Locale.ROOT)
                .replace("kcmil", "")
                .replace("mcm", "")
                .replace("awg", "")
                .trim();
        for (AwgSize size : values()) {
            if (size.designation.equals(normalized)) {
                return size;
            }
        }
        throw new IllegalArgumentException("Unknown AWG/kcmil conductor size: " + designation);
    }
}
