package dev.agentpanel.core.remote;

import dev.agentpanel.core.shared.Result;
import java.util.Optional;

/**
 * Parsing and quoting helpers for VS Code Remote-SSH authorities ({@code ssh-remote+user@host}).
 *
 * <p>Config validation, diagnostics and remote settings writes all go through here so the
 * accepted format and the shell quoting stay identical everywhere.
 */
public final class RemoteAuthority {
    public static final String PREFIX = "ssh-remote+";

    private RemoteAuthority() {}

    /**
     * Returns the SSH target ({@code user@host}) of a remote authority.
     *
     * <p>A target that starts with {@code -}, ignoring leading whitespace, is reported as
     * {@link RemoteAuthorityError#TARGET_STARTS_WITH_DASH} ahead of the whitespace check, so it can
     * never be read as an ssh option.
     */
    public static Result<String, RemoteAuthorityError> parse(String authority) {
        if (authority == null || !authority.startsWith(PREFIX)) {
            return Result.err(RemoteAuthorityError.MISSING_PREFIX);
        }
        String target = authority.substring(PREFIX.length());
        if (target.isEmpty()) {
            return Result.err(RemoteAuthorityError.MISSING_TARGET);
        }
        if (target.stripLeading().startsWith("-")) {
            return Result.err(RemoteAuthorityError.TARGET_STARTS_WITH_DASH);
        }
        for (int i = 0; i < authority.length(); i++) {
            if (Character.isWhitespace(authority.charAt(i)) || Character.isSpaceChar(authority.charAt(i))) {
                return Result.err(RemoteAuthorityError.CONTAINS_WHITESPACE);
            }
        }
        return Result.ok(target);
    }

    public static Optional<String> extractTarget(String authority) {
        return parse(authority).toOptional();
    }

    /**
     * POSIX single-quote escaping: wraps in single quotes and rewrites each embedded quote as {@code '\''}.
     */
    public static String shellEscape(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
