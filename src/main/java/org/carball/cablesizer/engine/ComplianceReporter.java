package org.carball.cablesizer.engine;

import org.carball.cablesizer.config.SizingThresholds;
import org.carball.cablesizer.model.sizing.AmpacityResult;
import org.carball.cablesizer.model.sizing.CableSizingInput;
import org.carball.cablesizer.model.sizing.CableSizingResult;
import org.carball.cablesizer.model.sizing.CandidateEvaluation;
import org.carball.cablesizer.model.sizing.ComplianceStatus;
import org.carball.cablesizer.model.sizing.DeratingFactor;
import org.carball.cablesizer.model.sizing.ProtectiveConductor;
import org.carball.cablesizer.model.sizing.RecommendedSize;
import org.carball.cablesizer.model.sizing.VoltageDrop;
import org.carball.cablesizer.model.sizing.VoltageDropResult;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.InstallationMethod;
import org.carball.cablesizer.model.standard.Standard;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Assembles the sizing result from an evaluated candidate. No lookups are
 * performed here; citations depend only on the standard and installation.
 */
public class ComplianceReporter {

    static final String EXHAUSTION_ADVICE =
            "exceeds maximum conductor size for standard table; consider splitting circuit or parallel runs";

    private final SizingThresholds thresholds;

    public ComplianceReporter(SizingThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * @param exhausted true when no tabulated size met both constraints and
     *                  {@code chosen} is the largest resolvable size
     */
    public CableSizingResult report(CableSizingInput input, CandidateEvaluation chosen, DeratingFactor derating,
                                    boolean exhausted, List<RecommendedSize> alternatives,
                                    ProtectiveConductor protectiveConductor) {
        VoltageDrop drop = chosen.voltageDrop();
        double percent = drop.percent();
        double utilization = chosen.utilizationPercent(input.getCurrent());

        VoltageDropResult voltageDrop = new VoltageDropResult(
                drop.volts(),
                percent,
                !chosen.voltageOk(),
                percent > thresholds.getDangerousVoltageDropPercent(),
                drop.resistance(),
                drop.resistanceUnit(),
                drop.multiplier());

        AmpacityResult ampacity = new AmpacityResult(
                chosen.conductor().baseAmpacity(), chosen.deratedAmpacity(), utilization);

        return new CableSizingResult(
                RecommendedSize.of(chosen.size()),
                voltageDrop,
                ampacity,
                derating,
                ComplianceStatus.of(chosen.voltageOk(), chosen.ampacityOk()),
                warnings(input, chosen, derating, exhausted),
                standardReferences(input.getStandard(), input.getInstallationMethod()),
                alternatives,
                protectiveConductor,
                input.getStandard());
    }

    List<String> warnings(CableSizingInput input, CandidateEvaluation chosen, DeratingFactor derating,
                          boolean exhausted) {
        List<String> warnings = new ArrayList<>();
        String failures = describeFailures(input, chosen);

        if (exhausted) {
            warnings.add(String.format("No standard conductor size meets all requirements (%s at %s): %s",
                    failures, chosen.size().formatted(), EXHAUSTION_ADVICE));
        } else if (input.hasExplicitSize() && !chosen.isFullyCompliant()) {
            warnings.add(String.format("Specified size %s does not meet requirements: %s",
                    chosen.size().formatted(), failures));
        }

        if (derating.temperatureFactor() < 0.5) {
            warnings.add(String.format(Locale.ROOT,
                    "High ambient temperature %s°C results in significant derating (%.0f%%)",
                    input.getAmbientTemperature(), derating.temperatureFactor() * 100));
        }
        if (derating.groupingFactor() < 0.5) {
            warnings.add(switch (input.getStandard()) {
                case NORTH_AMERICAN -> String.format(Locale.ROOT,
                        "Large number of conductors (%d) results in significant derating (%.0f%%)",
                        input.getConductorCount(), derating.groupingFactor() * 100);
                case INTERNATIONAL -> String.format(Locale.ROOT,
                        "Large number of circuits (%d) results in significant derating (%.0f%%)",
                        DeratingComposer.circuitsFor(input.getConductorCount()), derating.groupingFactor() * 100);
            });
        }
        if (derating.totalFactor() < 0.4) {
            warnings.add(String.format(Locale.ROOT,
                    "Combined derating factor %.0f%% is very low. Consider alternative installation method.",
                    derating.totalFactor() * 100));
        }

        double percent = chosen.voltageDrop().percent();
        if (percent > thresholds.getDangerousVoltageDropPercent()) {
            warnings.add(String.format(Locale.ROOT,
                    "Voltage drop %.1f%% exceeds %.0f%% and may cause equipment malfunction",
                    percent, thresholds.getDangerousVoltageDropPercent()));
        }

        double utilization = chosen.utilizationPercent(input.getCurrent());
        if (utilization > thresholds.getHighUtilizationPercent()) {
            warnings.add(String.format(Locale.ROOT,
                    "High cable utilization (%.0f%%). Consider next size up for safety margin.", utilization));
        }

        if (input.getMaterial() == ConductorMaterial.ALUMINUM) {
            warnings.add("Aluminum conductors require anti-oxidant compound and terminations rated for aluminum (AL or CU/AL).");
        }
        return warnings;
    }

    public List<String> standardReferences(Standard standard, InstallationMethod installationMethod) {
        InstallationMethod method = installationMethod != null ? installationMethod : InstallationMethod.SINGLE_CONDUIT;
        List<String> references = new ArrayList<>();
        switch (standard) {
            case NORTH_AMERICAN -> {
                references.add("NEC 2020 Table 310.15(B)(16)");
                references.add("NEC 2020 Chapter 9 Table 8");
                references.add("NEC 310.15(B)(2)(a)");
                references.add("NEC 310.15(C)(1)");
                references.add("NEC 210.19(A) Informational Note No. 4");
                if (method == InstallationMethod.DIRECT_BURIED) {
                    references.add("NEC Table 300.5");
                }
            }
            case INTERNATIONAL -> {
                references.add("IEC 60364-5-52 Table B.52.4");
                references.add("IEC 60364-5-52:2009 (voltage drop)");
                references.add("IEC 60364-5-52 Table B.52.14");
                references.add("IEC 60364-5-52 Table B.52.17 (" + method.getIecMethod().getLabel() + ")");
            }
        }
        return references;
    }

    private static String describeFailures(CableSizingInput input, CandidateEvaluation chosen) {
        List<String> failures = new ArrayList<>();
        if (!chosen.ampacityOk()) {
            failures.add(String.format(Locale.ROOT, "derated ampacity %.1f A is below the %.1f A load",
                    chosen.deratedAmpacity(), input.getCurrent()));
        }
        if (!chosen.voltageOk()) {
            failures.add(String.format(Locale.ROOT, "voltage drop %.2f%% exceeds the %.1f%% limit",
                    chosen.voltageDrop().percent(), input.getMaxVoltageDropPercent()));
        }
        return failures.isEmpty() ? "all constraints met" : String.join(" and ", failures);
    }
}
