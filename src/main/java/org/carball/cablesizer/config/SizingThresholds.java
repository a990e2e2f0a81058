package org.carball.cablesizer.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class SizingThresholds {

    // Voltage drop limits (percent of system voltage)
    @Builder.Default
    private double maxVoltageDropPercent = 3.0;

    @Builder.Default
    private double dangerousVoltageDropPercent = 10.0;

    // Ampacity utilization warning (percent of derated ampacity)
    @Builder.Default
    private double highUtilizationPercent = 80.0;

    // NEC adjustment beyond 40 conductors
    @Builder.Default
    private boolean extendedGroupingTable = false;

    @Builder.Default
    private int alternativeSizeCount = 3;

    // Result cache
    @Builder.Default
    private long cacheMaximumSize = 1000;

    @Builder.Default
    private long cacheExpireMinutes = 30;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default branch circuit limits";

    /**
     * Creates default thresholds: 3% voltage drop, 80% utilization warning.
     */
    public static SizingThresholds defaults() {
        return SizingThresholds.builder()
                .profileName("default")
                .profileDescription("Default branch circuit limits")
                .build();
    }

    /**
     * Validates the threshold configuration and logs warnings for potentially problematic values.
     */
    public void validate() {
        if (maxVoltageDropPercent <= 0) {
            log.warn("Maximum voltage drop ({}%) should be positive", maxVoltageDropPercent);
        }

        if (maxVoltageDropPercent > 5.0) {
            log.warn("Maximum voltage drop ({}%) is above the 5% combined feeder and branch recommendation",
                    maxVoltageDropPercent);
        }

        if (dangerousVoltageDropPercent <= maxVoltageDropPercent) {
            log.warn("Dangerous voltage drop ({}%) should be greater than maximum voltage drop ({}%)",
                    dangerousVoltageDropPercent, maxVoltageDropPercent);
        }

        if (highUtilizationPercent <= 0 || highUtilizationPercent > 100) {
            log.warn("High utilization threshold ({}%) should be between 0 and 100", highUtilizationPercent);
        }

        if (alternativeSizeCount < 0) {
            log.warn("Alternative size count ({}) should not be negative", alternativeSizeCount);
        }

        if (cacheMaximumSize < 0) {
            log.warn("Cache maximum size ({}) should not be negative", cacheMaximumSize);
        }

        if (cacheExpireMinutes <= 0) {
            log.warn("Cache expiry ({} minutes) should be positive", cacheExpireMinutes);
        }

        log.debug("Using thresholds - Max drop: {}%, Dangerous: {}%, Utilization: {}%, Profile: {}",
                maxVoltageDropPercent, dangerousVoltageDropPercent, highUtilizationPercent, profileName);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Profile: %s | Max drop: %.1f%% | Dangerous drop: %.1f%% | Utilization: %.0f%% | Extended grouping: %s",
                profileName, maxVoltageDropPercent, dangerousVoltageDropPercent,
                highUtilizationPercent, extendedGroupingTable ? "on" : "off");
    }
}
