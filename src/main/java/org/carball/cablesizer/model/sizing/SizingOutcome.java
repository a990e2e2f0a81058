package org.carball.cablesizer.model.sizing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.carball.cablesizer.validation.ValidationResult;

/**
 * Result of sizing one named circuit: either a {@link CableSizingResult} or
 * the reason none could be produced.
 */
public record SizingOutcome(
        String circuitName,
        CableSizingInput input,
        ValidationResult validation,
        CableSizingResult result,
        String error
) {

    @JsonIgnore
    public boolean isSuccessful() {
        return result != null;
    }
}
