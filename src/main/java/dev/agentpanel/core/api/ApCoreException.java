package dev.agentpanel.core.api;

import java.util.Objects;

/**
 * Unchecked carrier for an {@link ApCoreError} at call sites that cannot return a result value.
 */
public final class ApCoreException extends RuntimeException {
    private final ApCoreError error;

    public ApCoreException(ApCoreError error) {
        super(Objects.requireNonNull(error, "error").display());
        this.error = error;
    }

    public ApCoreException(ApCoreError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").display(), cause);
        this.error = error;
    }

    public ApCoreError error() {
        return error;
    }

    public ApCoreErrorCategory category() {
        return error.category();
    }
}
