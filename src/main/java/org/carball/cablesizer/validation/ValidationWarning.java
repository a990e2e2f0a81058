package org.carball.cablesizer.validation;

/**
 * Advisory note on an otherwise valid input. {@code reference} may be null.
 */
public record ValidationWarning(String field, String message, Severity severity, String reference) {
}
