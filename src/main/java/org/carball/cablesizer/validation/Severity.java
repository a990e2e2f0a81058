package org.carball.cablesizer.validation;

public enum Severity {
    INFO,
    WARNING,
    DANGER
}
