package org.carball.cablesizer.validation;

import java.util.List;

public record ValidationResult(boolean valid, List<String> errors, List<ValidationWarning> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<ValidationWarning> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }
}
