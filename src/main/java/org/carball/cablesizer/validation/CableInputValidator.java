package org.carball.cablesizer.validation;

import lombok.extern.slf4j.Slf4j;
import org.carball.cablesizer.model.sizing.CableSizingInput;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.InstallationMethod;
import org.carball.cablesizer.model.standard.Length;
import org.carball.cablesizer.model.standard.Standard;
import org.carball.cablesizer.tables.StandardTables;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Range checks and advisory warnings applied before a request reaches the
 * sizing engine, which itself only checks table membership.
 */
@Slf4j
public class CableInputValidator {

    static final Set<Integer> ACCEPTED_RATINGS = Set.of(60, 70, 75, 90);

    private final StandardTables tables;

    public CableInputValidator(StandardTables tables) {
        this.tables = tables;
    }

    /**
     * Converts the length to the standard's native unit and maps equivalent
     * insulation ratings onto the tabulated column (IEC 75 to 70, NEC 70 to 75).
     */
    public CableSizingInput normalize(CableSizingInput input) {
        Standard standard = input.getStandard();
        if (standard == null) {
            return input;
        }

        CableSizingInput.CableSizingInputBuilder builder = input.toBuilder();
        Length length = input.getLength();
        if (length != null && !length.isIn(standard.getLengthUnit())) {
            Length converted = length.to(standard.getLengthUnit());
            log.debug("Converted run length {} to {} for {}", length, converted, standard.getCode());
            builder.length(converted);
        }

        int rating = input.getInsulationRating();
        if (standard == Standard.INTERNATIONAL && rating == 75) {
            builder.insulationRating(70);
        } else if (standard == Standard.NORTH_AMERICAN && rating == 70) {
            builder.insulationRating(75);
        }
        return builder.build();
    }

    public ValidationResult validate(CableSizingInput input) {
        List<String> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        Standard standard = input.getStandard();
        if (standard == null) {
            errors.add("Standard is required (IEC or NEC)");
        }
        if (input.getMaterial() == null) {
            errors.add("Conductor material is required");
        }
        if (input.getCircuitType() == null) {
            errors.add("Circuit type is required");
        }
        if (input.getLength() == null) {
            errors.add("Length is required");
        }

        checkRange(errors, "Voltage", input.getSystemVoltage(), 1, 50_000, "V");
        checkRange(errors, "Current", input.getCurrent(), 0.1, 10_000, "A");

        if (input.getLength() != null) {
            Length length = standard != null ? input.getLength().to(standard.getLengthUnit()) : input.getLength();
            if (!Double.isFinite(length.value())) {
                errors.add("Length must be a number");
            } else if (length.value() < 0.1) {
                errors.add("Length must be at least 0.1 " + length.unit().getSymbol());
            } else if (length.value() > 10_000) {
                errors.add("Length cannot exceed 10,000 " + length.unit().getSymbol());
            }
        }

        if (input.getConductorCount() < 1) {
            errors.add("At least 1 conductor required");
        } else if (input.getConductorCount() > 50) {
            errors.add("Cannot exceed 50 conductors");
        }

        double ambient = input.getAmbientTemperature();
        if (ambient < -40) {
            errors.add("Temperature cannot be below -40°C");
        } else if (ambient > 90) {
            errors.add("Temperature cannot exceed 90°C");
        } else if (standard != null && ambient > tables.maximumAmbient(standard)) {
            errors.add(String.format("Temperature %s°C is beyond the %s correction table (max %s°C)",
                    ambient, standard.getCode(), tables.maximumAmbient(standard)));
        }

        if (!ACCEPTED_RATINGS.contains(input.getInsulationRating())) {
            errors.add("Invalid insulation rating. Use 60, 70, 75, or 90°C.");
        }

        if (input.getMaxVoltageDropPercent() <= 0 || input.getMaxVoltageDropPercent() > 100) {
            errors.add("Maximum voltage drop must be greater than 0% and at most 100%");
        }

        if (input.hasExplicitSize() && standard != null && input.getExplicitSize().standard() != standard) {
            errors.add(String.format("Size %s is not a %s conductor size",
                    input.getExplicitSize().formatted(), standard.getCode()));
        }

        if (standard != null) {
            addWarnings(input, standard, warnings);
        }

        ValidationResult result = ValidationResult.of(errors, warnings);
        log.debug("Validation finished: {} errors, {} warnings", errors.size(), warnings.size());
        return result;
    }

    private void addWarnings(CableSizingInput input, Standard standard, List<ValidationWarning> warnings) {
        boolean nec = standard == Standard.NORTH_AMERICAN;
        double ambient = input.getAmbientTemperature();

        if (ambient > 50) {
            warnings.add(new ValidationWarning("ambientTemperature",
                    String.format("High ambient temperature (%s°C) will significantly reduce cable ampacity", ambient),
                    Severity.WARNING,
                    nec ? "NEC 310.15(B)(2)(a)" : "IEC 60364-5-52 Table B.52.14"));
        }
        if (ambient > 70) {
            warnings.add(new ValidationWarning("ambientTemperature",
                    String.format("Extreme ambient temperature (%s°C) - verify insulation rating is adequate", ambient),
                    Severity.DANGER, null));
        }

        if (input.getConductorCount() > 20) {
            warnings.add(new ValidationWarning("conductorCount",
                    String.format("Large number of conductors (%d) results in significant derating",
                            input.getConductorCount()),
                    Severity.WARNING,
                    nec ? "NEC 310.15(C)(1)" : "IEC 60364-5-52 Table B.52.17"));
        }

        if (input.getLength() != null) {
            double length = input.getLength().to(standard.getLengthUnit()).value();
            if (!nec && length > 200) {
                warnings.add(new ValidationWarning("length",
                        "Long cable run - verify voltage drop is acceptable",
                        Severity.INFO, "IEC 60364-5-52"));
            }
            if (length > 500) {
                warnings.add(new ValidationWarning("length",
                        "Very long cable run - consider intermediate substations or voltage step-up",
                        Severity.WARNING, null));
            }
        }

        if (input.getCurrent() > 500) {
            warnings.add(new ValidationWarning("current",
                    "High current load - consider parallel conductors",
                    Severity.INFO, nec ? "NEC 310.10(H)" : "IEC 60364-5-52"));
        }

        if (input.getSystemVoltage() <= 48) {
            warnings.add(new ValidationWarning("systemVoltage",
                    "Low voltage system - voltage drop tolerance may be critical",
                    Severity.INFO, null));
        }
        if (input.getSystemVoltage() >= 2400) {
            warnings.add(new ValidationWarning("systemVoltage",
                    "Medium voltage system - ensure proper insulation and terminations",
                    Severity.INFO, nec ? "NEC Article 310" : "IEC 60502"));
        }

        if (input.getMaterial() == ConductorMaterial.ALUMINUM && input.getCurrent() < 15) {
            warnings.add(new ValidationWarning("material",
                    "Aluminum conductors not typically used for small currents - consider copper",
                    Severity.INFO, null));
        }

        if (input.getInstallationMethod() == InstallationMethod.DIRECT_BURIED) {
            warnings.add(new ValidationWarning("installationMethod",
                    "Direct burial - ensure proper depth and protection per local codes",
                    Severity.INFO, nec ? "NEC Table 300.5" : "IEC 60364-5-52"));
        }
    }

    private static void checkRange(List<String> errors, String label, double value,
                                   double min, double max, String unit) {
        if (!Double.isFinite(value)) {
            errors.add(label + " must be a number");
        } else if (value < min) {
            errors.add(String.format("%s must be at least %s%s", label, format(min), unit));
        } else if (value > max) {
            errors.add(String.format("%s cannot exceed %s%s", label, format(max), unit));
        }
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.format(Locale.ROOT, "%,d", (long) value) : String.valueOf(value);
    }
}
