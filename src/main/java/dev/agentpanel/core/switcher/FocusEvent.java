package dev.agentpanel.core.switcher;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One focus-history entry. Session events carry no project id.
 */
public record FocusEvent(FocusEventKind kind, Optional<String> projectId, Instant timestamp) {
    public FocusEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static FocusEvent projectActivated(String projectId, Instant timestamp) {
        return new FocusEvent(FocusEventKind.PROJECT_ACTIVATED, Optional.of(projectId), timestamp);
    }
}
