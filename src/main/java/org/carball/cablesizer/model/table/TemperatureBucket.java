package org.carball.cablesizer.model.table;

import java.util.Map;

/**
 * Ambient temperature step covering {@code (lowerExclusive, upperInclusive]}.
 */
public record TemperatureBucket(
        double lowerExclusive,
        double upperInclusive,
        Map<Integer, Double> factorByRating
) {

    public boolean contains(double ambient) {
        return ambient > lowerExclusive && ambient <= upperInclusive;
    }

    public Double factorFor(int insulationRating) {
        return factorByRating.get(insulationRating);
    }
}
