package org.carball.cablesizer.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
