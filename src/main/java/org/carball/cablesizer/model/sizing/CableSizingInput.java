package org.carball.cablesizer.model.sizing;

import lombok.Builder;
import lombok.Value;
import org.carball.cablesizer.model.standard.CircuitType;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.ConductorSize;
import org.carball.cablesizer.model.standard.InstallationMethod;
import org.carball.cablesizer.model.standard.Length;
import org.carball.cablesizer.model.standard.Standard;

/**
 * One sizing request. Value equality covers every field, so instances double
 * as cache keys.
 */
@Value
@Builder(toBuilder = true)
public class CableSizingInput {

    double current;

    Length length;

    double systemVoltage;

    @Builder.Default
    ConductorMaterial material = ConductorMaterial.COPPER;

    @Builder.Default
    InstallationMethod installationMethod = InstallationMethod.SINGLE_CONDUIT;

    @Builder.Default
    CircuitType circuitType = CircuitType.SINGLE_PHASE;

    @Builder.Default
    double ambientTemperature = 30;

    @Builder.Default
    int conductorCount = 3;

    int insulationRating;

    Standard standard;

    @Builder.Default
    double maxVoltageDropPercent = 3.0;

    // When set, only this size is evaluated.
    ConductorSize explicitSize;

    public boolean hasExplicitSize() {
        return explicitSize != null;
    }
}
