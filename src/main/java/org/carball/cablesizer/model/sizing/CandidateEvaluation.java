package org.carball.cablesizer.model.sizing;

import org.carball.cablesizer.model.standard.ConductorSize;

/**
 * Outcome of checking one candidate size against both constraints.
 */
public record CandidateEvaluation(
        ConductorSize size,
        ResolvedConductor conductor,
        double deratedAmpacity,
        VoltageDrop voltageDrop,
        boolean ampacityOk,
        boolean voltageOk
) {

    public boolean isFullyCompliant() {
        return ampacityOk && voltageOk;
    }

    public double utilizationPercent(double current) {
        return deratedAmpacity > 0 ? current / deratedAmpacity * 100 : Double.POSITIVE_INFINITY;
    }
}
