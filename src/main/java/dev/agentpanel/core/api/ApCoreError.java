package dev.agentpanel.core.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Categorized error value used across AgentPanel.
 *
 * <p>The configuration pipeline only produces {@code validation}, {@code fileSystem},
 * {@code configuration} and {@code parse} errors; the remaining categories belong to the
 * command runner and window management layers.
 */
public record ApCoreError(
    ApCoreErrorCategory category,
    String message,
    Optional<String> detail,
    Optional<String> command,
    Optional<Integer> exitCode
) {
    public ApCoreError {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(detail, "detail");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(exitCode, "exitCode");
    }

    public static ApCoreError of(ApCoreErrorCategory category, String message, String detail) {
        return new ApCoreError(category, message, Optional.ofNullable(detail), Optional.empty(), Optional.empty());
    }

    public static ApCoreError validation(String message, String detail) {
        return of(ApCoreErrorCategory.VALIDATION, message, detail);
    }

    public static ApCoreError fileSystem(String message, String detail) {
        return of(ApCoreErrorCategory.FILE_SYSTEM, message, detail);
    }

    public static ApCoreError configuration(String message, String detail) {
        return of(ApCoreErrorCategory.CONFIGURATION, message, detail);
    }

    public static ApCoreError parse(String message, String detail) {
        return of(ApCoreErrorCategory.PARSE, message, detail);
    }

    public String display() {
        return detail.map(d -> message + " (" + d + ")").orElse(message);
    }
}
