package dev.agentpanel.core.identity;

import java.util.Locale;
import java.util.Set;

/**
 * Turns free-form names (project names, workspace names) into canonical identifiers.
 *
 * <p>Rules: trim, lowercase, every character outside {@code [a-z0-9]} becomes a hyphen, runs of
 * hyphens collapse to one and leading/trailing hyphens are dropped. The function is idempotent.
 */
public final class IdNormalizer {
    private static final Set<String> RESERVED = Set.of("inbox");

    private IdNormalizer() {}

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String lowered = value.trim().toLowerCase(Locale.ROOT);
        StringBuilder normalized = new StringBuilder(lowered.length());
        boolean previousWasHyphen = false;
        for (int i = 0; i < lowered.length(); i++) {
            char ch = lowered.charAt(i);
            if ((ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9')) {
                normalized.append(ch);
                previousWasHyphen = false;
            } else if (!previousWasHyphen) {
                normalized.append('-');
                previousWasHyphen = true;
            }
        }
        int start = 0;
        int end = normalized.length();
        while (start < end && normalized.charAt(start) == '-') {
            start++;
        }
        while (end > start && normalized.charAt(end - 1) == '-') {
            end--;
        }
        return normalized.substring(start, end);
    }

    /**
     * Identifiers the workspace router keeps for itself.
     */
    public static boolean isReserved(String normalizedId) {
        return RESERVED.contains(normalizedId);
    }
}
