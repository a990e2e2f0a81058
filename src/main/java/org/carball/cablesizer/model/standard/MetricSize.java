package org.carball.cablesizer.model.standard;

import java.util.Locale;

public enum MetricSize implements ConductorSize {
    MM2_1_5(1.5),
    MM2_2_5(2.5),
    MM2_4(4),
    MM2_6(6),
    MM2_10(10),
    MM2_16(16),
    MM2_25(25),
    MM2_35(35),
    MM2_50(50),
    MM2_70(70),
    MM2_95(95),
    MM2_120(120),
    MM2_150(150),
    MM2_185(185),
    MM2_240(240),
    MM2_300(300),
    MM2_400(400),
    MM2_500(500),
    MM2_630(630);

    private final double crossSection;

    MetricSize(double crossSection) {
        this.crossSection = crossSection;
    }

    public double getCrossSection() {
        return crossSection;
    }

    @Override
    public Standard standard() {
        return Standard.INTERNATIONAL;
    }

    @Override
    public String designation() {
        if (crossSection == Math.rint(crossSection)) {
            return String.valueOf((int) crossSection);
        }
        return String.format(Locale.ROOT, "%.1f", crossSection);
    }

    @Override
    public String formatted() {
        return designation() + " mm²";
    }

    @Override
    public int index() {
        return ordinal();
    }

    /**
     * Smallest tabulated size whose cross-section is at least {@code mm2}.
     */
    public static MetricSize ceiling(double mm2) {
        for (MetricSize size : values()) {
            if (size.crossSection >= mm2) {
                return size;
            }
        }
        throw new IllegalArgumentException("No metric size of at least " + mm2 + " mm²");
    }

    public static MetricSize fromDesignation(String designation) {
        String normalized = designation.trim().toLowerCase(Locale.ROOT)
                .replace("mm²", "")
                .replace("mm2", "")
                .trim();
        try {
            double value = Double.parseDouble(normalized);
            for (MetricSize size : values()) {
                if (size.crossSection == value) {
                    return size;
                }
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid metric conductor size: " + designation);
        }
        throw new IllegalArgumentException("Unknown metric conductor size: " + designation);
    }
}
