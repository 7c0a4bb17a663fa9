package dev.agentpanel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Named project colors and hex parsing.
 */
public final class ProjectColorPalette {
    private static final Map<String, Rgb> NAMED = Map.ofEntries(
        Map.entry("black", new Rgb(0.0, 0.0, 0.0)),
        Map.entry("blue", new Rgb(0.0, 0.0, 1.0)),
        Map.entry("brown", new Rgb(0.6471, 0.1647, 0.1647)),
        Map.entry("cyan", new Rgb(0.0, 1.0, 1.0)),
        Map.entry("gray", new Rgb(0.5020, 0.5020, 0.5020)),
        Map.entry("grey", new Rgb(0.5020, 0.5020, 0.5020)),
        Map.entry("green", new Rgb(0.0, 0.5020, 0.0)),
        Map.entry("indigo", new Rgb(0.2941, 0.0, 0.5098)),
        Map.entry("orange", new Rgb(1.0, 0.6471, 0.0)),
        Map.entry("pink", new Rgb(1.0, 0.7529, 0.7961)),
        Map.entry("purple", new Rgb(0.5020, 0.0, 0.5020)),
        Map.entry("red", new Rgb(1.0, 0.0, 0.0)),
        Map.entry("teal", new Rgb(0.0, 0.5020, 0.5020)),
        Map.entry("white", new Rgb(1.0, 1.0, 1.0)),
        Map.entry("yellow", new Rgb(1.0, 1.0, 0.0))
    );

    private static final List<String> SORTED_NAMES;

    static {
        List<String> names = new ArrayList<>(NAMED.keySet());
        Collections.sort(names);
        SORTED_NAMES = List.copyOf(names);
    }

    private ProjectColorPalette() {}

    /**
     * RGB components in the 0..1 range.
     */
    public record Rgb(double red, double green, double blue) {}

    public static List<String> sortedNames() {
        return SORTED_NAMES;
    }

    public static boolean isNamed(String value) {
        return NAMED.containsKey(value);
    }

    /**
     * {@code #} followed by exactly six hex digits, either case.
     */
    public static boolean isValidHex(String value) {
        if (value == null || value.length() != 7 || value.charAt(0) != '#') {
            return false;
        }
        for (int i = 1; i < value.length(); i++) {
            if (!isAsciiHexDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAsciiHexDigit(char ch) {
        return (ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'f') || (ch >= 'A' && ch <= 'F');
    }

    /**
     * Resolves a hex or named color (names are case-insensitive).
     */
    public static Optional<Rgb> resolve(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (isValidHex(trimmed)) {
            int rgb = Integer.parseInt(trimmed.substring(1), 16);
            return Optional.of(new Rgb(
                ((rgb >> 16) & 0xFF) / 255.0,
                ((rgb >> 8) & 0xFF) / 255.0,
                (rgb & 0xFF) / 255.0
            ));
        }
        return Optional.ofNullable(NAMED.get(trimmed.toLowerCase(Locale.ROOT)));
    }

    public static String toHex(Rgb rgb) {
        return String.format(
            Locale.ROOT,
            "#%02X%02X%02X",
            Math.round(rgb.red() * 255.0),
            Math.round(rgb.green() * 255.0),
            Math.round(rgb.blue() * 255.0)
        );
    }
}
