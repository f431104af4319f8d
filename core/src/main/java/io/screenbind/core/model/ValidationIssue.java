package io.screenbind.core.model;

import java.util.Objects;

/**
 * A single finding from binding validation.
 *
 * @param severity {@link Severity#ERROR} blocks publishing, {@link Severity#WARNING} is
 *                 informational
 * @param type     machine-readable category, e.g. {@code unknown-function}
 * @param message  user-facing description
 */
public record ValidationIssue(Severity severity, String type, String message) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationIssue error(String type, String message) {
        return new ValidationIssue(Severity.ERROR, type, message);
    }

    public static ValidationIssue warning(String type, String message) {
        return new ValidationIssue(Severity.WARNING, type, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
