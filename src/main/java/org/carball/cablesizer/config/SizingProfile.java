package org.carball.cablesizer.config;

import lombok.Getter;

@Getter
public enum SizingProfile {

    // Circuit role
    BRANCH("branch", "Branch circuits - 3% voltage drop (NEC 210.19(A) Informational Note No. 4)",
            3.0, 80.0),

    FEEDER("feeder", "Feeders - 2% voltage drop leaving 3% for branch circuits",
            2.0, 80.0),

    COMBINED("combined", "Feeder and branch combined - 5% total voltage drop",
            5.0, 80.0),

    // Installation type
    SENSITIVE("sensitive", "Sensitive electronic loads - tight voltage drop and utilization margins",
            1.5, 70.0) {
        @Override
        public SizingThresholds buildThresholds() {
            SizingThresholds base = super.buildThresholds();
            return base.toBuilder()
                    .dangerousVoltageDropPercent(5.0) // Electronics misbehave well before 10%
                    .build();
        }
    },

    INDUSTRIAL("industrial", "Industrial plant - 5% voltage drop, large conductor bundles allowed",
            5.0, 85.0) {
        @Override
        public SizingThresholds buildThresholds() {
            SizingThresholds base = super.buildThresholds();
            return base.toBuilder()
                    .extendedGroupingTable(true) // Trays routinely carry more than 40 conductors
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double maxVoltageDropPercent;
    private final double highUtilizationPercent;

    SizingProfile(String name, String description, double maxVoltageDropPercent, double highUtilizationPercent) {
        this.name = name;
        this.description = description;
        this.maxVoltageDropPercent = maxVoltageDropPercent;
        this.highUtilizationPercent = highUtilizationPercent;
    }

    /**
     * Creates SizingThresholds based on this profile's settings.
     */
    public SizingThresholds buildThresholds() {
        return SizingThresholds.builder()
                .profileName(name)
                .profileDescription(description)
                .maxVoltageDropPercent(maxVoltageDropPercent)
                .highUtilizationPercent(highUtilizationPercent)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static SizingProfile fromName(String name) {
        for (SizingProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown sizing profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    /**
     * Returns a comma-separated list of available profile names.
     */
    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (SizingProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    /**
     * Returns detailed information about all available profiles.
     */
    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Sizing Profiles:\n\n");

        help.append("=== Circuit Role ===\n");
        addProfileHelp(help, BRANCH, FEEDER, COMBINED);

        help.append("\n=== Installation Type ===\n");
        addProfileHelp(help, SENSITIVE, INDUSTRIAL);

        help.append("\nUse --profile <name> to select a profile, or --help-thresholds for detailed threshold information.\n");

        return help.toString();
    }

    private static void addProfileHelp(StringBuilder help, SizingProfile... profiles) {
        for (SizingProfile profile : profiles) {
            help.append(String.format("  %-12s %s\n", profile.getName(), profile.getDescription()));
        }
    }
}
