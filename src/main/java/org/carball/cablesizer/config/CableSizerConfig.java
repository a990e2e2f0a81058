package org.carball.cablesizer.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class CableSizerConfig {
    private Path circuitFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private String profileName;
    private boolean verbose;
    private SizingThresholds thresholds;
}
