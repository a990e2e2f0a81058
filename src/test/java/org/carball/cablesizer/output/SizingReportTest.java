package org.carball.cablesizer.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.cablesizer.config.SizingThresholds;
import org.carball.cablesizer.engine.CableSizer;
import org.carball.cablesizer.model.sizing.CableSizingInput;
import org.carball.cablesizer.model.sizing.SizingOutcome;
import org.carball.cablesizer.model.standard.CircuitType;
import org.carball.cablesizer.model.standard.ConductorMaterial;
import org.carball.cablesizer.model.standard.Length;
import org.carball.cablesizer.model.standard.Standard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SizingReportTest {

    private List<SizingOutcome> outcomes;

    @BeforeEach
    void setUp() {
        CableSizer sizer = new CableSizer(SizingThresholds.defaults());
        outcomes = List.of(
                sizer.size("kitchen", CableSizingInput.builder()
                        .standard(Standard.INTERNATIONAL)
                        .current(30)
                        .length(Length.meters(50))
                        .systemVoltage(230)
                        .insulationRating(70)
                        .build()),
                sizer.size("chiller", CableSizingInput.builder()
                        .standard(Standard.INTERNATIONAL)
                        .current(600)
                        .length(Length.meters(10))
                        .systemVoltage(400)
                        .circuitType(CircuitType.THREE_PHASE)
                        .insulationRating(70)
                        .build()),
                sizer.size("shed", CableSizingInput.builder()
                        .standard(Standard.NORTH_AMERICAN)
                        .material(ConductorMaterial.ALUMINUM)
                        .current(20)
                        .length(Length.feet(50))
                        .systemVoltage(120)
                        .insulationRating(75)
                        .conductorCount(45)
                        .build()),
                new SizingOutcome("broken", null, null, null, "Circuit 'broken' has no standard"));
    }

    @Test
    void shouldSerializeResultsToJson() throws Exception {
        // Given
        SizingReport report = new SizingReport("Plant", outcomes, SizingThresholds.defaults());

        // When
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Then
        assertThat(json.get("project").asText()).isEqualTo("Plant");
        assertThat(json.get("profile").asText()).isEqualTo("default");
        assertThat(json.get("summary").get("totalCircuits").asInt()).isEqualTo(4);
        assertThat(json.get("summary").get("compliant").asInt()).isEqualTo(1);
        assertThat(json.get("summary").get("nonCompliant").asInt()).isEqualTo(1);
        assertThat(json.get("summary").get("failed").asInt()).isEqualTo(2);

        JsonNode kitchen = json.get("circuits").get(0).get("result");
        assertThat(kitchen.get("recommendedSize").get("formatted").asText()).isEqualTo("10 mm²");
        assertThat(kitchen.get("compliance").get("isFullyCompliant").asBoolean()).isTrue();
        assertThat(kitchen.get("voltageDrop").get("isViolation").asBoolean()).isFalse();
        assertThat(kitchen.get("alternativeSizes")).hasSize(3);
        assertThat(kitchen.has("fullyCompliant")).isFalse();

        JsonNode broken = json.get("circuits").get(3);
        assertThat(broken.has("result")).isFalse();
        assertThat(broken.get("error").asText()).contains("has no standard");
    }

    @Test
    void shouldRenderMarkdownReport() {
        // Given
        SizingReport report = new SizingReport("Plant", outcomes, SizingThresholds.defaults());

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown).startsWith("# Cable Sizing Report");
        assertThat(markdown).contains("**Project:** Plant");
        assertThat(markdown).contains("| Fully Compliant | 1 |");
        assertThat(markdown).contains("| kitchen | IEC | 30.0 A | 50.0 m | 10 mm² | 2.39% | 55.6% | ✅ Compliant |");
        assertThat(markdown).contains("| chiller | IEC | 600.0 A | 10.0 m | 630 mm² |");
        assertThat(markdown).contains("⚠️ Non-compliant");
        assertThat(markdown).contains("| broken | - | - | - | - | - | - | ❌ Failed |");
        assertThat(markdown).contains("- **Alternatives:** 16 mm², 25 mm², 35 mm²");
        assertThat(markdown).contains("#### Warnings");
        assertThat(markdown).contains("#### Input Advisories");
        assertThat(markdown).contains("- **Error:** No NEC adjustment factor for 45");
        assertThat(markdown).contains("IEC 60364-5-52 Table B.52.17 (Method B)");
    }
}
