package dev.agentpanel.core.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code [layout]} section driving window placement.
 *
 * <p>Bounds: {@code smallScreenThreshold > 0}, {@code windowHeight} in 1..100,
 * {@code maxWindowWidth > 0}, {@code maxGap} in 0..100. A section that violates any bound is
 * replaced by {@link #defaults()} as a whole.
 *
 * @param smallScreenThreshold physical monitor width in inches below which small-screen mode is used
 * @param windowHeight window height as a percentage of the screen height
 * @param maxWindowWidth maximum window width in inches
 * @param idePosition side of the IDE window in wide mode
 * @param justification screen edge the window pair is anchored to
 * @param maxGap maximum gap between windows as a percentage of the screen width
 */
public record LayoutConfig(
    double smallScreenThreshold,
    int windowHeight,
    double maxWindowWidth,
    IdePosition idePosition,
    Justification justification,
    int maxGap
) {
    public static final double DEFAULT_SMALL_SCREEN_THRESHOLD = 24;
    public static final int DEFAULT_WINDOW_HEIGHT = 90;
    public static final double DEFAULT_MAX_WINDOW_WIDTH = 18;
    public static final IdePosition DEFAULT_IDE_POSITION = IdePosition.LEFT;
    public static final Justification DEFAULT_JUSTIFICATION = Justification.RIGHT;
    public static final int DEFAULT_MAX_GAP = 10;

    private static final LayoutConfig DEFAULTS = new LayoutConfig(
        DEFAULT_SMALL_SCREEN_THRESHOLD,
        DEFAULT_WINDOW_HEIGHT,
        DEFAULT_MAX_WINDOW_WIDTH,
        DEFAULT_IDE_POSITION,
        DEFAULT_JUSTIFICATION,
        DEFAULT_MAX_GAP
    );

    public LayoutConfig {
        Objects.requireNonNull(idePosition, "idePosition");
        Objects.requireNonNull(justification, "justification");
    }

    public static LayoutConfig defaults() {
        return DEFAULTS;
    }

    public enum IdePosition {
        LEFT,
        RIGHT;

        public String configValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Matches the exact lowercase config spelling ({@code "left"} / {@code "right"}).
         */
        public static Optional<IdePosition> fromConfigValue(String value) {
            for (IdePosition position : values()) {
                if (position.configValue().equals(value)) {
                    return Optional.of(position);
                }
            }
            return Optional.empty();
        }
    }

    public enum Justification {
        LEFT,
        RIGHT;

        public String configValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<Justification> fromConfigValue(String value) {
            for (Justification justification : values()) {
                if (justification.configValue().equals(value)) {
                    return Optional.of(justification);
                }
            }
            return Optional.empty();
        }
    }
}
