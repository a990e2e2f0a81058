package org.carball.cablesizer.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public SizingThresholds loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        // Start with defaults
        SizingThresholds.SizingThresholdsBuilder builder = SizingThresholds.defaults().toBuilder();

        // 1. Apply environment variables
        applyEnvironmentVariables(builder);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        SizingThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Loads configuration from a specific profile.
     */
    public SizingThresholds loadProfile(String profileName) {
        try {
            SizingProfile profile = SizingProfile.fromName(profileName);
            SizingThresholds thresholds = profile.buildThresholds();
            log.info("Loaded profile '{}': {}", profileName, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads and applies profile, then overlays with other configuration sources.
     */
    public SizingThresholds loadConfigurationWithProfile(String profileName, String[] args) {
        // Start with profile
        SizingThresholds profileThresholds = loadProfile(profileName);
        SizingThresholds.SizingThresholdsBuilder builder = profileThresholds.toBuilder();

        // Apply overrides in hierarchy order
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        SizingThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded with profile '{}': {}", profileName, thresholds.getConfigurationSummary());
        return thresholds;
    }

    private void applyEnvironmentVariables(SizingThresholds.SizingThresholdsBuilder builder) {
        applyEnvironmentVariable("CABLESIZER_MAX_VOLTAGE_DROP_PERCENT",
                value -> builder.maxVoltageDropPercent(Double.parseDouble(value)));
        applyEnvironmentVariable("CABLESIZER_DANGEROUS_VOLTAGE_DROP_PERCENT",
                value -> builder.dangerousVoltageDropPercent(Double.parseDouble(value)));
        applyEnvironmentVariable("CABLESIZER_HIGH_UTILIZATION_PERCENT",
                value -> builder.highUtilizationPercent(Double.parseDouble(value)));
        applyEnvironmentVariable("CABLESIZER_EXTENDED_GROUPING_TABLE",
                value -> builder.extendedGroupingTable(Boolean.parseBoolean(value)));
        applyEnvironmentVariable("CABLESIZER_ALTERNATIVE_SIZE_COUNT",
                value -> builder.alternativeSizeCount(Integer.parseInt(value)));
        applyEnvironmentVariable("CABLESIZER_CACHE_MAXIMUM_SIZE",
                value -> builder.cacheMaximumSize(Long.parseLong(value)));
        applyEnvironmentVariable("CABLESIZER_CACHE_EXPIRE_MINUTES",
                value -> builder.cacheExpireMinutes(Long.parseLong(value)));
    }

    private void applyEnvironmentVariable(String name, Consumer<String> setter) {
        if (!environment.containsKey(name)) {
            return;
        }
        String value = environment.get(name);
        try {
            setter.accept(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, value);
        }
    }

    private void applyCLIArguments(SizingThresholds.SizingThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--thresholds.max-voltage-drop":
                        builder.maxVoltageDropPercent(Double.parseDouble(value));
                        break;
                    case "--thresholds.dangerous-voltage-drop":
                        builder.dangerousVoltageDropPercent(Double.parseDouble(value));
                        break;
                    case "--thresholds.high-utilization":
                        builder.highUtilizationPercent(Double.parseDouble(value));
                        break;
                    case "--thresholds.extended-grouping":
                        builder.extendedGroupingTable(Boolean.parseBoolean(value));
                        break;
                    case "--thresholds.alternatives":
                        builder.alternativeSizeCount(Integer.parseInt(value));
                        break;
                    case "--thresholds.cache-size":
                        builder.cacheMaximumSize(Long.parseLong(value));
                        break;
                    case "--thresholds.cache-expire-minutes":
                        builder.cacheExpireMinutes(Long.parseLong(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds.max-voltage-drop <pct>        Maximum voltage drop for compliance (default 3.0)
              --thresholds.dangerous-voltage-drop <pct>  Voltage drop flagged as dangerous (default 10.0)
              --thresholds.high-utilization <pct>        Utilization that triggers a warning (default 80)
              --thresholds.extended-grouping <bool>      Allow NEC adjustment above 40 conductors
              --thresholds.alternatives <num>            Number of larger compliant sizes to list
              --thresholds.cache-size <num>              Maximum cached sizing results
              --thresholds.cache-expire-minutes <num>    Cached result lifetime

            Environment Variables:
              CABLESIZER_MAX_VOLTAGE_DROP_PERCENT        Same as --thresholds.max-voltage-drop
              CABLESIZER_DANGEROUS_VOLTAGE_DROP_PERCENT  Same as --thresholds.dangerous-voltage-drop
              CABLESIZER_HIGH_UTILIZATION_PERCENT        Same as --thresholds.high-utilization
              CABLESIZER_EXTENDED_GROUPING_TABLE         Same as --thresholds.extended-grouping
              CABLESIZER_ALTERNATIVE_SIZE_COUNT          Same as --thresholds.alternatives
              CABLESIZER_CACHE_MAXIMUM_SIZE              Same as --thresholds.cache-size
              CABLESIZER_CACHE_EXPIRE_MINUTES            Same as --thresholds.cache-expire-minutes

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Profile defaults or built-in defaults
            """;
    }
}
