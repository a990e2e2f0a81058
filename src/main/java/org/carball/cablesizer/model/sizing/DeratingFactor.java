package org.carball.cablesizer.model.sizing;

/**
 * Combined ambient and grouping correction. {@code totalFactor} is always in (0, 1].
 */
public record DeratingFactor(
        double temperatureFactor,
        double groupingFactor,
        double totalFactor,
        String standardReference
) {
}
