package org.carball.cablesizer.model.sizing;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ComplianceStatus(
        @JsonProperty("isVoltageDropCompliant") boolean isVoltageDropCompliant,
        @JsonProperty("isAmpacityCompliant") boolean isAmpacityCompliant,
        @JsonProperty("isFullyCompliant") boolean isFullyCompliant
) {

    public static ComplianceStatus of(boolean voltageDropCompliant, boolean ampacityCompliant) {
        return new ComplianceStatus(voltageDropCompliant, ampacityCompliant,
                voltageDropCompliant && ampacityCompliant);
    }
}
