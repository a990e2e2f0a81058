package org.carball.cablesizer.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.cablesizer.config.CableSizerConfig;
import org.carball.cablesizer.config.ConfigurationLoader;
import org.carball.cablesizer.config.OutputFormat;
import org.carball.cablesizer.config.SizingProfile;
import org.carball.cablesizer.config.SizingThresholds;
import org.carball.cablesizer.engine.CableSizer;
import org.carball.cablesizer.model.job.CircuitDefinition;
import org.carball.cablesizer.model.job.CircuitFile;
import org.carball.cablesizer.model.sizing.CableSizingInput;
import org.carball.cablesizer.model.sizing.CableSizingResult;
import org.carball.cablesizer.model.sizing.SizingOutcome;
import org.carball.cablesizer.output.SizingReport;
import org.carball.cablesizer.parser.CircuitFileParser;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
public class CableSizerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║        Cable Sizer - IEC 60364-5-52 / NEC 2020 v%s         ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the CLI and returns the process exit status.
     */
    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        List<String> argList = Arrays.asList(args);
        if (argList.contains("--help-profiles")) {
            System.out.println(SizingProfile.getProfileHelp());
            return 0;
        }
        if (argList.contains("--help-thresholds")) {
            System.out.println(ConfigurationLoader.getThresholdHelp());
            return 0;
        }
        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            CableSizerConfig config = parseArgs(args);
            if (config.isVerbose()) {
                enableVerboseLogging();
            }

            System.out.println("\n🔌 Starting cable sizing...");
            System.out.println("   Circuit file: " + config.getCircuitFile());
            System.out.println("   " + config.getThresholds().getConfigurationSummary());
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println();

            // Step 1: Read circuits
            System.out.print("📄 Reading circuit definitions... ");
            CircuitFile circuitFile = new CircuitFileParser().parse(config.getCircuitFile());
            System.out.println("✓");

            // Step 2: Size every circuit
            System.out.print("📐 Sizing conductors... ");
            CableSizer sizer = new CableSizer(config.getThresholds());
            List<SizingOutcome> outcomes = sizeCircuits(circuitFile, sizer, config.getThresholds());
            System.out.println("✓");
            log.debug(sizer.getCache().getStatsSummary());

            // Step 3: Output results
            System.out.print("📝 Writing results... ");
            SizingReport report = new SizingReport(circuitFile.getProject(), outcomes, config.getThresholds());
            outputResults(report, config);
            System.out.println("✓");

            printSummary(outcomes);

            System.out.println("\n✅ Sizing complete!");
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output files:");
                System.out.println("     - " + baseFileName + ".json");
                System.out.println("     - " + baseFileName + ".md");
            } else {
                System.out.println("   Output file: " + config.getOutputFile());
            }
            return 0;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar cable-sizer.jar <circuit-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  circuit-file        YAML (.yml/.yaml) or JSON file listing the circuits to size");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: cable-sizing.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --profile, -p       Sizing profile: " + SizingProfile.getAvailableProfiles());
        System.out.println("  --thresholds.*      Override a threshold, see --help-thresholds");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help-profiles     Describe the available profiles");
        System.out.println("  --help-thresholds   Describe threshold options and environment variables");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Size branch circuits with the default 3% voltage drop limit");
        System.out.println("  java -jar cable-sizer.jar circuits.yml");
        System.out.println();
        System.out.println("  # Feeder sizing with a Markdown report");
        System.out.println("  java -jar cable-sizer.jar feeders.yml --profile feeder --format markdown");
        System.out.println();
        System.out.println("  # Tighter utilization margin");
        System.out.println("  java -jar cable-sizer.jar circuits.json --thresholds.high-utilization 70");
    }

    private static CableSizerConfig parseArgs(String[] args) {
        CableSizerConfig config = new CableSizerConfig();
        config.setCircuitFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputFile("cable-sizing.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setVerbose(false);

        // Parse optional arguments
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output file not specified");
                    }
                    config.setOutputFile(args[++i]);
                    break;

                case "--format":
                case "-f":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output format not specified");
                    }
                    try {
                        OutputFormat format = OutputFormat.valueOf(args[++i].toUpperCase());
                        config.setOutputFormat(format);
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--profile":
                case "-p":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Profile not specified");
                    }
                    config.setProfileName(args[++i]);
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    if (args[i].startsWith("--thresholds.")) {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Value not specified for " + args[i]);
                        }
                        // Consumed by ConfigurationLoader
                        i++;
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        switch (config.getOutputFormat()) {
            case MARKDOWN:
                config.setOutputFile(baseFileName + ".md");
                break;
            case BOTH:
            case JSON:
            default:
                config.setOutputFile(baseFileName + ".json");
                break;
        }

        ConfigurationLoader loader = new ConfigurationLoader();
        SizingThresholds thresholds = config.getProfileName() != null
                ? loader.loadConfigurationWithProfile(config.getProfileName(), args)
                : loader.loadConfiguration(args);
        config.setThresholds(thresholds);

        validateConfig(config);
        return config;
    }

    private static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            // Check if this is a path with directories
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(CableSizerConfig config) {
        if (!Files.exists(config.getCircuitFile())) {
            throw new IllegalArgumentException("Circuit file not found: " + config.getCircuitFile());
        }

        if (Files.isDirectory(config.getCircuitFile())) {
            throw new IllegalArgumentException("Circuit file must be a file, not a directory");
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static List<SizingOutcome> sizeCircuits(CircuitFile circuitFile, CableSizer sizer,
                                                    SizingThresholds thresholds) {
        List<SizingOutcome> outcomes = new ArrayList<>();
        for (CircuitDefinition circuit : circuitFile.getCircuits()) {
            CableSizingInput input;
            try {
                input = circuit.toInput(thresholds);
            } catch (IllegalArgumentException e) {
                log.warn("Circuit '{}' skipped: {}", circuit.getName(), e.getMessage());
                outcomes.add(new SizingOutcome(circuit.getName(), null, null, null, e.getMessage()));
                continue;
            }
            outcomes.add(sizer.size(circuit.getName(), input));
        }
        return outcomes;
    }

    private static void outputResults(SizingReport report, CableSizerConfig config) throws IOException {
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            String jsonFile = config.getOutputFormat() == OutputFormat.BOTH ?
                    baseFileName + ".json" : config.getOutputFile();
            Files.writeString(Paths.get(jsonFile), report.toJson());
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            String markdownFile = config.getOutputFormat() == OutputFormat.BOTH ?
                    baseFileName + ".md" : config.getOutputFile();
            Files.writeString(Paths.get(markdownFile), report.toMarkdown());
        }
    }

    private static void printSummary(List<SizingOutcome> outcomes) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 SIZING SUMMARY");
        System.out.println("=".repeat(60));

        long compliant = outcomes.stream()
                .filter(o -> o.isSuccessful() && o.result().isFullyCompliant())
                .count();
        long nonCompliant = outcomes.stream()
                .filter(o -> o.isSuccessful() && !o.result().isFullyCompliant())
                .count();
        long failed = outcomes.stream().filter(o -> !o.isSuccessful()).count();

        System.out.println("\nCircuits sized: " + outcomes.size());
        System.out.println("  🟢 Compliant: " + compliant);
        System.out.println("  🟡 Non-compliant: " + nonCompliant);
        System.out.println("  🔴 Failed: " + failed);

        System.out.println("\n🔧 Recommended Conductors:");
        System.out.println("-".repeat(60));
        for (SizingOutcome outcome : outcomes) {
            if (!outcome.isSuccessful()) {
                System.out.printf("%-20s → %s%n", outcome.circuitName(), "ERROR: " + outcome.error());
                continue;
            }
            CableSizingResult result = outcome.result();
            System.out.printf("%-20s → %-12s drop %.2f%%, utilization %.0f%%%n",
                    outcome.circuitName(),
                    result.recommendedSize().formatted(),
                    result.voltageDrop().percent(),
                    result.ampacity().utilizationPercent());
            if (result.protectiveConductor() != null) {
                System.out.printf("  └─ Protective conductor: %s%n", result.protectiveConductor().formatted());
            }
        }
    }

    private static void enableVerboseLogging() {
        Logger logger = (Logger) LoggerFactory.getLogger("org.carball.cablesizer");
        logger.setLevel(Level.DEBUG);
    }
}
