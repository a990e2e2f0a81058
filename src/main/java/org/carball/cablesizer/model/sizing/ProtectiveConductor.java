package org.carball.cablesizer.model.sizing;

/**
 * Recommended protective earth (IEC) or equipment grounding (NEC) conductor.
 */
public record ProtectiveConductor(String size, String formatted, String rule, String standardReference) {
}
