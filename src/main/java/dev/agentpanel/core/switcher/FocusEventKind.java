package dev.agentpanel.core.switcher;

/**
 * Kinds of entries in the focus history.
 */
public enum FocusEventKind {
    PROJECT_ACTIVATED,
    PROJECT_DEACTIVATED,
    WINDOW_FOCUSED,
    WINDOW_DEFOCUSED,
    SESSION_STARTED,
    SESSION_ENDED
}
