package org.carball.cablesizer.model.sizing;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VoltageDropResult(
        double volts,
        double percent,
        @JsonProperty("isViolation") boolean isViolation,
        @JsonProperty("isDangerous") boolean isDangerous,
        double resistance,
        String resistanceUnit,
        double circuitMultiplier
) {
}
