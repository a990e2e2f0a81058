package org.carball.cablesizer.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.cablesizer.cache.SizingCache;
import org.carball.cablesizer.config.SizingThresholds;
import org.carball.cablesizer.model.sizing.CableSizingInput;
import org.carball.cablesizer.model.sizing.CableSizingResult;
import org.carball.cablesizer.model.sizing.SizingOutcome;
import org.carball.cablesizer.tables.StandardTables;
import org.carball.cablesizer.validation.CableInputValidator;
import org.carball.cablesizer.validation.ValidationResult;

/**
 * Entry point wiring validation, the result cache and the selector.
 */
@Slf4j
public class CableSizer {

    private final CableInputValidator validator;
    private final ConductorSelector selector;
    private final SizingCache cache;

    public CableSizer(SizingThresholds thresholds) {
        this(StandardTables.forConfiguration(thresholds.isExtendedGroupingTable()), thresholds);
    }

    public CableSizer(StandardTables tables, SizingThresholds thresholds) {
        this(new CableInputValidator(tables), new ConductorSelector(tables, thresholds), SizingCache.from(thresholds));
    }

    public CableSizer(CableInputValidator validator, ConductorSelector selector, SizingCache cache) {
        this.validator = validator;
        this.selector = selector;
        this.cache = cache;
    }

    /**
     * Sizes a pre-validated input whose length is already in the standard's unit.
     *
     * @throws LookupException when the tables cannot serve the request
     */
    public CableSizingResult selectConductor(CableSizingInput input) {
        return cache.get(input, selector::select);
    }

    /**
     * Normalizes, validates and sizes one circuit. Validation errors and lookup
     * failures are reported in the outcome rather than thrown.
     */
    public SizingOutcome size(String circuitName, CableSizingInput input) {
        CableSizingInput normalized = validator.normalize(input);
        ValidationResult validation = validator.validate(normalized);

        if (!validation.valid()) {
            log.warn("Circuit '{}' failed validation: {}", circuitName, String.join("; ", validation.errors()));
            return new SizingOutcome(circuitName, normalized, validation, null,
                    String.join("; ", validation.errors()));
        }

        try {
            CableSizingResult result = selectConductor(normalized);
            log.info("Circuit '{}': {} ({})", circuitName, result.recommendedSize().formatted(),
                    result.isFullyCompliant() ? "compliant" : "NON-COMPLIANT");
            return new SizingOutcome(circuitName, normalized, validation, result, null);
        } catch (LookupException e) {
            log.warn("Circuit '{}' could not be sized: {}", circuitName, e.getMessage());
            return new SizingOutcome(circuitName, normalized, validation, null, e.getMessage());
        }
    }

    public SizingCache getCache() {
        return cache;
    }
}
