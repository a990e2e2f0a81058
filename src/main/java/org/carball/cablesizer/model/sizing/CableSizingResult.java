package org.carball.cablesizer.model.sizing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.carball.cablesizer.model.standard.Standard;

import java.util.List;

public record CableSizingResult(
        RecommendedSize recommendedSize,
        VoltageDropResult voltageDrop,
        AmpacityResult ampacity,
        DeratingFactor deratingFactors,
        ComplianceStatus compliance,
        List<String> warnings,
        List<String> standardReferences,
        List<RecommendedSize> alternativeSizes,
        ProtectiveConductor protectiveConductor,
        Standard standard
) {

    public CableSizingResult {
        warnings = List.copyOf(warnings);
        standardReferences = List.copyOf(standardReferences);
        alternativeSizes = List.copyOf(alternativeSizes);
    }

    @JsonIgnore
    public boolean isFullyCompliant() {
        return compliance.isFullyCompliant();
    }
}
