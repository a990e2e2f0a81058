package org.carball.cablesizer.model.sizing;

public record AmpacityResult(double base, double derated, double utilizationPercent) {
}
