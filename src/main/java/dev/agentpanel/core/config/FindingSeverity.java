package dev.agentpanel.core.config;

/**
 * Severity of a {@link ConfigFinding}.
 */
public enum FindingSeverity {
    PASS,
    WARN,
    FAIL;

    /**
     * Display order, failures first.
     */
    public int sortOrder() {
        switch (this) {
            case FAIL:
                return 0;
            case WARN:
                return 1;
            default:
                return 2;
        }
    }
}
