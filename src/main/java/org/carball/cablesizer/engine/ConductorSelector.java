package org.carball.cablesizer.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.cablesizer.config.SizingThresholds;
import org.carball.cablesizer.model.sizing.CableSizingInput;
import org.carball.cablesizer.model.sizing.CableSizingResult;
import org.carball.cablesizer.model.sizing.CandidateEvaluation;
import org.carball.cablesizer.model.sizing.DeratingFactor;
import org.carball.cablesizer.model.sizing.ProtectiveConductor;
import org.carball.cablesizer.model.sizing.RecommendedSize;
import org.carball.cablesizer.model.sizing.ResolvedConductor;
import org.carball.cablesizer.model.sizing.VoltageDrop;
import org.carball.cablesizer.model.standard.ConductorSize;
import org.carball.cablesizer.model.standard.Standard;
import org.carball.cablesizer.tables.StandardTables;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the smallest tabulated size whose derated ampacity carries the load
 * and whose voltage drop stays within the limit. When no size satisfies both,
 * the largest resolvable size is returned flagged as non-compliant.
 */
@Slf4j
public class ConductorSelector {

    private final AmpacityResolver ampacityResolver;
    private final DeratingComposer deratingComposer;
    private final VoltageDropCalculator voltageDropCalculator;
    private final ComplianceReporter complianceReporter;
    private final EarthConductorSizer earthConductorSizer;
    private final int alternativeSizeCount;

    public ConductorSelector(StandardTables tables, SizingThresholds thresholds) {
        this(new AmpacityResolver(tables),
                new DeratingComposer(tables),
                new VoltageDropCalculator(tables),
                new ComplianceReporter(thresholds),
                new EarthConductorSizer(tables),
                thresholds.getAlternativeSizeCount());
    }

    public ConductorSelector(AmpacityResolver ampacityResolver,
                             DeratingComposer deratingComposer,
                             VoltageDropCalculator voltageDropCalculator,
                             ComplianceReporter complianceReporter,
                             EarthConductorSizer earthConductorSizer,
                             int alternativeSizeCount) {
        this.ampacityResolver = ampacityResolver;
        this.deratingComposer = deratingComposer;
        this.voltageDropCalculator = voltageDropCalculator;
        this.complianceReporter = complianceReporter;
        this.earthConductorSizer = earthConductorSizer;
        this.alternativeSizeCount = Math.max(0, alternativeSizeCount);
    }

    public CableSizingResult select(CableSizingInput input) {
        Standard standard = input.getStandard();
        DeratingFactor derating = deratingComposer.compose(standard, input.getAmbientTemperature(),
                input.getInsulationRating(), input.getConductorCount(), input.getInstallationMethod());

        if (input.hasExplicitSize()) {
            return verify(input, derating);
        }

        List<ConductorSize> sizes = standard.sizes();
        CandidateEvaluation largestResolved = null;

        for (int i = 0; i < sizes.size(); i++) {
            ConductorSize size = sizes.get(i);
            CandidateEvaluation candidate;
            try {
                candidate = evaluate(input, size, derating);
            } catch (LookupException e) {
                log.debug("Skipping candidate {}: {}", size.formatted(), e.getMessage());
                continue;
            }

            largestResolved = candidate;
            if (candidate.isFullyCompliant()) {
                log.debug("Selected {} for {} A: derated {} A, drop {}%", size.formatted(),
                        input.getCurrent(), candidate.deratedAmpacity(), candidate.voltageDrop().percent());
                return complianceReporter.report(input, candidate, derating, false,
                        alternatives(input, derating, sizes, i + 1),
                        protectiveConductor(input, size));
            }
        }

        if (largestResolved == null) {
            throw new LookupException(standard, String.format(
                    "No %s %s conductor could be resolved at %d°C insulation",
                    standard.getCode(), input.getMaterial().getDisplayName().toLowerCase(),
                    input.getInsulationRating()));
        }

        log.info("No {} size satisfies {} A at {} within {}%; reporting {} as non-compliant",
                standard.getCode(), input.getCurrent(), input.getLength(), input.getMaxVoltageDropPercent(),
                largestResolved.size().formatted());
        return complianceReporter.report(input, largestResolved, derating, true, List.of(),
                protectiveConductor(input, largestResolved.size()));
    }

    /**
     * Checks both constraints for one size.
     */
    public CandidateEvaluation evaluate(CableSizingInput input, ConductorSize size, DeratingFactor derating) {
        ResolvedConductor conductor = ampacityResolver.resolve(input.getStandard(), input.getMaterial(),
                input.getInsulationRating(), size);
        double deratedAmpacity = conductor.baseAmpacity() * derating.totalFactor();
        boolean ampacityOk = deratedAmpacity >= input.getCurrent();

        VoltageDrop drop = voltageDropCalculator.drop(input.getCurrent(), input.getLength(), conductor.resistance(),
                input.getCircuitType(), input.getStandard(), input.getSystemVoltage());
        boolean voltageOk = !VoltageDropCalculator.exceedsLimit(drop.percent(), input.getMaxVoltageDropPercent());

        log.trace("Candidate {}: derated {} A ({}), drop {}% ({})", size.formatted(), deratedAmpacity,
                ampacityOk ? "ok" : "short", drop.percent(), voltageOk ? "ok" : "over");
        return new CandidateEvaluation(size, conductor, deratedAmpacity, drop, ampacityOk, voltageOk);
    }

    private CableSizingResult verify(CableSizingInput input, DeratingFactor derating) {
        ConductorSize size = input.getExplicitSize();
        CandidateEvaluation candidate = evaluate(input, size, derating);
        log.debug("Verified specified size {}: {}", size.formatted(),
                candidate.isFullyCompliant() ? "compliant" : "non-compliant");
        return complianceReporter.report(input, candidate, derating, false, List.of(),
                protectiveConductor(input, size));
    }

    private List<RecommendedSize> alternatives(CableSizingInput input, DeratingFactor derating,
                                               List<ConductorSize> sizes, int from) {
        List<RecommendedSize> alternatives = new ArrayList<>();
        for (int i = from; i < sizes.size() && alternatives.size() < alternativeSizeCount; i++) {
            try {
                if (evaluate(input, sizes.get(i), derating).isFullyCompliant()) {
                    alternatives.add(RecommendedSize.of(sizes.get(i)));
                }
            } catch (LookupException e) {
                log.debug("Skipping alternative {}: {}", sizes.get(i).formatted(), e.getMessage());
            }
        }
        return alternatives;
    }

    private ProtectiveConductor protectiveConductor(CableSizingInput input, ConductorSize phaseSize) {
        try {
            return earthConductorSizer.size(input.getStandard(), phaseSize, input.getCurrent(), input.getMaterial());
        } catch (LookupException e) {
            log.warn("No protective conductor recommendation for {}: {}", phaseSize.formatted(), e.getMessage());
            return null;
        }
    }
}
