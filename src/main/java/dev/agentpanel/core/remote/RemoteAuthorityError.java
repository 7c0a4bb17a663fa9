package dev.agentpanel.core.remote;

/**
 * Reasons a VS Code Remote-SSH authority string is rejected.
 */
public enum RemoteAuthorityError {
    MISSING_PREFIX,
    CONTAINS_WHITESPACE,
    MISSING_TARGET,
    TARGET_STARTS_WITH_DASH
}
