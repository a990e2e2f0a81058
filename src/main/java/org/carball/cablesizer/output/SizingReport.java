package org.carball.cablesizer.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.cablesizer.config.SizingThresholds;
import org.carball.cablesizer.model.sizing.CableSizingInput;
import org.carball.cablesizer.model.sizing.CableSizingResult;
import org.carball.cablesizer.model.sizing.DeratingFactor;
import org.carball.cablesizer.model.sizing.RecommendedSize;
import org.carball.cablesizer.model.sizing.SizingOutcome;
import org.carball.cablesizer.validation.ValidationWarning;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
public class SizingReport {

    private static final String VERSION = "1.0.0";

    private final String project;
    private final List<SizingOutcome> outcomes;
    private final SizingThresholds thresholds;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public SizingReport(String project, List<SizingOutcome> outcomes, SizingThresholds thresholds) {
        this.project = project;
        this.outcomes = List.copyOf(outcomes);
        this.thresholds = thresholds;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        // Header
        md.append("# Cable Sizing Report\n\n");
        if (project != null) {
            md.append("**Project:** ").append(project).append("  \n");
        }
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Profile:** ").append(thresholds.getProfileName()).append("  \n");
        md.append("**Sizer Version:** ").append(VERSION).append("  \n\n");

        // Summary
        ReportSummary summary = buildSummary();
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Circuits | ").append(summary.totalCircuits()).append(" |\n");
        md.append("| Fully Compliant | ").append(summary.compliant()).append(" |\n");
        md.append("| Non-Compliant | ").append(summary.nonCompliant()).append(" |\n");
        md.append("| Failed | ").append(summary.failed()).append(" |\n");
        md.append("| Voltage Drop Limit | ").append(format("%.1f%%", thresholds.getMaxVoltageDropPercent())).append(" |\n\n");

        // Overview table
        md.append("## Circuit Overview\n\n");
        md.append("| Circuit | Standard | Load | Length | Size | Voltage Drop | Utilization | Status |\n");
        md.append("|---------|----------|------|--------|------|--------------|-------------|--------|\n");
        for (SizingOutcome outcome : outcomes) {
            CableSizingInput input = outcome.input();
            CableSizingResult result = outcome.result();
            md.append("| ").append(outcome.circuitName());
            if (input != null) {
                md.append(" | ").append(input.getStandard() != null ? input.getStandard().getCode() : "-")
                        .append(" | ").append(format("%.1f A", input.getCurrent()))
                        .append(" | ").append(input.getLength() != null ? input.getLength() : "-");
            } else {
                md.append(" | - | - | -");
            }
            if (result != null) {
                md.append(" | ").append(result.recommendedSize().formatted())
                        .append(" | ").append(format("%.2f%%", result.voltageDrop().percent()))
                        .append(" | ").append(format("%.1f%%", result.ampacity().utilizationPercent()));
            } else {
                md.append(" | - | - | -");
            }
            md.append(" | ").append(statusLabel(outcome)).append(" |\n");
        }
        md.append("\n");

        // Details
        md.append("## Circuit Details\n\n");
        for (SizingOutcome outcome : outcomes) {
            appendDetails(md, outcome);
        }

        return md.toString();
    }

    private void appendDetails(StringBuilder md, SizingOutcome outcome) {
        md.append("### ").append(outcome.circuitName()).append("\n\n");

        CableSizingResult result = outcome.result();
        if (result == null) {
            md.append("- **Status:** ").append(statusLabel(outcome)).append("\n");
            md.append("- **Error:** ").append(outcome.error()).append("\n\n");
            appendAdvisories(md, outcome);
            return;
        }

        DeratingFactor derating = result.deratingFactors();
        md.append("- **Status:** ").append(statusLabel(outcome)).append("\n");
        md.append("- **Recommended Size:** ").append(result.recommendedSize().formatted()).append("\n");
        md.append("- **Voltage Drop:** ")
                .append(format("%.2f V (%.2f%%)", result.voltageDrop().volts(), result.voltageDrop().percent()))
                .append(" using ").append(format("%s %s", result.voltageDrop().resistance(), result.voltageDrop().resistanceUnit()))
                .append("\n");
        md.append("- **Ampacity:** ")
                .append(format("base %.1f A, derated %.1f A, utilization %.1f%%",
                        result.ampacity().base(), result.ampacity().derated(), result.ampacity().utilizationPercent()))
                .append("\n");
        md.append("- **Derating:** ")
                .append(format("temperature %.2f × grouping %.2f = %.3f",
                        derating.temperatureFactor(), derating.groupingFactor(), derating.totalFactor()))
                .append(" (").append(derating.standardReference()).append(")\n");
        if (result.protectiveConductor() != null) {
            md.append("- **Protective Conductor:** ").append(result.protectiveConductor().formatted())
                    .append(" (").append(result.protectiveConductor().rule()).append(", ")
                    .append(result.protectiveConductor().standardReference()).append(")\n");
        }
        if (!result.alternativeSizes().isEmpty()) {
            md.append("- **Alternatives:** ").append(result.alternativeSizes().stream()
                    .map(RecommendedSize::formatted)
                    .collect(Collectors.joining(", "))).append("\n");
        }
        md.append("\n");

        if (!result.warnings().isEmpty()) {
            md.append("#### Warnings\n\n");
            result.warnings().forEach(warning -> md.append("- ").append(warning).append("\n"));
            md.append("\n");
        }

        appendAdvisories(md, outcome);

        md.append("#### Standard References\n\n");
        result.standardReferences().forEach(reference -> md.append("- ").append(reference).append("\n"));
        md.append("\n");
    }

    private void appendAdvisories(StringBuilder md, SizingOutcome outcome) {
        if (outcome.validation() == null || outcome.validation().warnings().isEmpty()) {
            return;
        }
        md.append("#### Input Advisories\n\n");
        for (ValidationWarning warning : outcome.validation().warnings()) {
            md.append("- **").append(warning.severity()).append(":** ").append(warning.message());
            if (warning.reference() != null) {
                md.append(" (").append(warning.reference()).append(")");
            }
            md.append("\n");
        }
        md.append("\n");
    }

    private static String statusLabel(SizingOutcome outcome) {
        if (!outcome.isSuccessful()) {
            return "❌ Failed";
        }
        return outcome.result().isFullyCompliant() ? "✅ Compliant" : "⚠️ Non-compliant";
    }

    private ReportData buildReportData() {
        return new ReportData(project, timestamp, VERSION, thresholds.getProfileName(),
                thresholds.getMaxVoltageDropPercent(), buildSummary(), outcomes);
    }

    private ReportSummary buildSummary() {
        int compliant = 0;
        int nonCompliant = 0;
        int failed = 0;
        for (SizingOutcome outcome : outcomes) {
            if (!outcome.isSuccessful()) {
                failed++;
            } else if (outcome.result().isFullyCompliant()) {
                compliant++;
            } else {
                nonCompliant++;
            }
        }
        return new ReportSummary(outcomes.size(), compliant, nonCompliant, failed);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    public record ReportData(String project, LocalDateTime generatedAt, String version, String profile,
                      double maxVoltageDropPercent, ReportSummary summary, List<SizingOutcome> circuits) {
    }

    public record ReportSummary(int totalCircuits, int compliant, int nonCompliant, int failed) {
    }
}
