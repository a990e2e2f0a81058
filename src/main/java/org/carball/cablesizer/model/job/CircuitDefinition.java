package org.carball.cablesizer.model.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import org.carball.cablesizer.config.SizingThresholds;
import org.carball.cablesizer.model.sizing.CableSizingInput;
import org.carball.cablesizer.model.standard.CircuitType;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.InstallationMethod;
import org.carball.cablesizer.model.standard.Length;
import org.carball.cablesizer.model.standard.LengthUnit;
import org.carball.cablesizer.model.standard.Standard;

/**
 * One circuit as written in a job file. Omitted fields fall back to the
 * standard's conventions and the active thresholds.
 */
@Data
public class CircuitDefinition {

    @JsonProperty("name")
    private String name;

    @JsonProperty("standard")
    private String standard;

    @JsonProperty("current")
    private Double current;

    @JsonProperty("length")
    private Double length;

    @JsonProperty("length_unit")
    private String lengthUnit;

    @JsonProperty("system_voltage")
    private Double systemVoltage;

    @JsonProperty("material")
    private String material = "copper";

    @JsonProperty("installation_method")
    private String installationMethod = "single-conduit";

    @JsonProperty("circuit_type")
    private String circuitType = "single-phase";

    @JsonProperty("ambient_temperature")
    private double ambientTemperature = 30;

    @JsonProperty("conductor_count")
    private int conductorCount = 3;

    @JsonProperty("insulation_rating")
    private int insulationRating = 75;

    @JsonProperty("max_voltage_drop_percent")
    private Double maxVoltageDropPercent;

    // Verify this size instead of searching
    @JsonProperty("size")
    private String size;

    public CableSizingInput toInput(SizingThresholds thresholds) {
        if (standard == null) {
            throw new IllegalArgumentException("Circuit '" + name + "' has no standard");
        }
        if (current == null || length == null) {
            throw new IllegalArgumentException("Circuit '" + name + "' needs both current and length");
        }

        Standard parsedStandard = Standard.fromName(standard);
        LengthUnit unit = lengthUnit != null ? LengthUnit.fromName(lengthUnit) : parsedStandard.getLengthUnit();

        return CableSizingInput.builder()
                .standard(parsedStandard)
                .current(current)
                .length(new Length(length, unit))
                .systemVoltage(systemVoltage != null ? systemVoltage : parsedStandard.getNominalVoltage())
                .material(ConductorMaterial.fromName(material))
                .installationMethod(InstallationMethod.fromName(installationMethod))
                .circuitType(CircuitType.fromName(circuitType))
                .ambientTemperature(ambientTemperature)
                .conductorCount(conductorCount)
                .insulationRating(insulationRating)
                .maxVoltageDropPercent(maxVoltageDropPercent != null
                        ? maxVoltageDropPercent : thresholds.getMaxVoltageDropPercent())
                .explicitSize(size != null ? parsedStandard.parseSize(size) : null)
                .build();
    }
}
