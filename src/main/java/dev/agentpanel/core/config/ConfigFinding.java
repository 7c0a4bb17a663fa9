package dev.agentpanel.core.config;

import java.util.Objects;
import java.util.Optional;

/**
 * One content-level diagnostic about the configuration, with an optional remediation hint.
 */
public record ConfigFinding(FindingSeverity severity, String title, Optional<String> detail, Optional<String> fix) {
    public ConfigFinding {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(detail, "detail");
        Objects.requireNonNull(fix, "fix");
    }

    public static ConfigFinding pass(String title, String detail) {
        return new ConfigFinding(FindingSeverity.PASS, title, Optional.ofNullable(detail), Optional.empty());
    }

    public static ConfigFinding warn(String title, String detail, String fix) {
        return new ConfigFinding(FindingSeverity.WARN, title, Optional.ofNullable(detail), Optional.ofNullable(fix));
    }

    public static ConfigFinding fail(String title, String fix) {
        return new ConfigFinding(FindingSeverity.FAIL, title, Optional.empty(), Optional.ofNullable(fix));
    }

    public static ConfigFinding fail(String title, String detail, String fix) {
        return new ConfigFinding(FindingSeverity.FAIL, title, Optional.ofNullable(detail), Optional.ofNullable(fix));
    }

    public boolean isFailure() {
        return severity == FindingSeverity.FAIL;
    }
}
