package org.carball.cablesizer.model.table;

/**
 * Conductor-count range with its grouping factor, both bounds inclusive.
 */
public record GroupingBucket(int minConductors, int maxConductors, double factor) {

    public boolean contains(int conductorCount) {
        return conductorCount >= minConductors && conductorCount <= maxConductors;
    }
}
