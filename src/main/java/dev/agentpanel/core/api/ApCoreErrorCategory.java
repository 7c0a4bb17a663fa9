package dev.agentpanel.core.api;

/**
 * Categories shared by every AgentPanel subsystem so callers can route failures uniformly.
 */
public enum ApCoreErrorCategory {
    COMMAND("command"),
    VALIDATION("validation"),
    FILE_SYSTEM("fileSystem"),
    CONFIGURATION("configuration"),
    PARSE("parse"),
    WINDOW("window"),
    SYSTEM("system");

    private final String label;

    ApCoreErrorCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
