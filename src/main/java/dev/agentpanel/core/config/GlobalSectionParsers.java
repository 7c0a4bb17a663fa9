package dev.agentpanel.core.config;

import java.util.List;
import java.util.Optional;

/**
 * Parsers for the optional global sections ({@code [app]}, {@code [agentLayer]}, {@code [chrome]},
 * {@code [layout]}). Each returns its section's defaults when the section is absent or not a table.
 *
 * <p>A section whose bound or format checks fail falls back to its defaults as a whole, dropping
 * sibling fields that were individually valid. Reader type errors only reset the affected field.
 */
final class GlobalSectionParsers {
    private GlobalSectionParsers() {}

    static AppConfig parseApp(TomlValue.TableValue root, List<ConfigFinding> findings) {
        Optional<TomlValue.TableValue> section = sectionTable(root, "app", findings);
        if (section.isEmpty()) {
            return AppConfig.defaults();
        }
        TomlValue.TableValue table = section.get();
        FieldReaders.checkForUnknownKeys(table, ConfigParser.KNOWN_APP_KEYS, "[app]", findings);
        boolean autoStart = FieldReaders.readOptionalBool(table, "autoStartAtLogin", false, "app.autoStartAtLogin", findings);
        return new AppConfig(autoStart);
    }

    static AgentLayerConfig parseAgentLayer(TomlValue.TableValue root, List<ConfigFinding> findings) {
        Optional<TomlValue.TableValue> section = sectionTable(root, "agentLayer", findings);
        if (section.isEmpty()) {
            return AgentLayerConfig.defaults();
        }
        TomlValue.TableValue table = section.get();
        FieldReaders.checkForUnknownKeys(table, ConfigParser.KNOWN_AGENT_LAYER_KEYS, "[agentLayer]", findings);
        boolean enabled = FieldReaders.readOptionalBool(table, "enabled", false, "agentLayer.enabled", findings);
        return new AgentLayerConfig(enabled);
    }

    static ChromeConfig parseChrome(TomlValue.TableValue root, List<ConfigFinding> findings) {
        Optional<TomlValue.TableValue> section = sectionTable(root, "chrome", findings);
        if (section.isEmpty()) {
            return ChromeConfig.defaults();
        }
        TomlValue.TableValue table = section.get();
        FieldReaders.checkForUnknownKeys(table, ConfigParser.KNOWN_CHROME_KEYS, "[chrome]", findings);

        List<String> pinnedTabs = FieldReaders.readOptionalStringArray(table, "pinnedTabs", "chrome.pinnedTabs", findings);
        boolean valid = FieldReaders.validateUrls(pinnedTabs, "chrome.pinnedTabs", findings);
        List<String> defaultTabs = FieldReaders.readOptionalStringArray(table, "defaultTabs", "chrome.defaultTabs", findings);
        valid &= FieldReaders.validateUrls(defaultTabs, "chrome.defaultTabs", findings);
        boolean openGitRemote = FieldReaders.readOptionalBool(table, "openGitRemote", false, "chrome.openGitRemote", findings);

        if (!valid) {
            return ChromeConfig.defaults();
        }
        return new ChromeConfig(pinnedTabs, defaultTabs, openGitRemote);
    }

    static LayoutConfig parseLayout(TomlValue.TableValue root, List<ConfigFinding> findings) {
        Optional<TomlValue.TableValue> section = sectionTable(root, "layout", findings);
        if (section.isEmpty()) {
            return LayoutConfig.defaults();
        }
        TomlValue.TableValue table = section.get();
        FieldReaders.checkForUnknownKeys(table, ConfigParser.KNOWN_LAYOUT_KEYS, "[layout]", findings);

        Optional<Double> smallScreenThreshold =
            FieldReaders.readOptionalNumber(table, "smallScreenThreshold", "layout.smallScreenThreshold", findings);
        Optional<Long> windowHeight = FieldReaders.readOptionalInteger(table, "windowHeight", "layout.windowHeight", findings);
        Optional<Double> maxWindowWidth = FieldReaders.readOptionalNumber(table, "maxWindowWidth", "layout.maxWindowWidth", findings);
        Optional<String> idePositionRaw =
            FieldReaders.readOptionalNonEmptyString(table, "idePosition", "layout.idePosition", findings);
        Optional<String> justificationRaw =
            FieldReaders.readOptionalNonEmptyString(table, "justification", "layout.justification", findings);
        Optional<Long> maxGap = FieldReaders.readOptionalInteger(table, "maxGap", "layout.maxGap", findings);

        boolean valid = true;

        if (smallScreenThreshold.isPresent() && !(smallScreenThreshold.get() > 0)) {
            findings.add(ConfigFinding.fail(
                "layout.smallScreenThreshold must be > 0",
                "Got " + formatNumber(smallScreenThreshold.get()) + ".",
                "Set smallScreenThreshold to a positive number (default: 24)."
            ));
            valid = false;
        }

        if (windowHeight.isPresent() && (windowHeight.get() < 1 || windowHeight.get() > 100)) {
            findings.add(ConfigFinding.fail(
                "layout.windowHeight must be 1–100",
                "Got " + windowHeight.get() + ".",
                "Set windowHeight to a value between 1 and 100 (default: 90)."
            ));
            valid = false;
        }

        if (maxWindowWidth.isPresent() && !(maxWindowWidth.get() > 0)) {
            findings.add(ConfigFinding.fail(
                "layout.maxWindowWidth must be > 0",
                "Got " + formatNumber(maxWindowWidth.get()) + ".",
                "Set maxWindowWidth to a positive number (default: 18)."
            ));
            valid = false;
        }

        LayoutConfig.IdePosition idePosition = LayoutConfig.DEFAULT_IDE_POSITION;
        if (idePositionRaw.isPresent()) {
            Optional<LayoutConfig.IdePosition> parsed = LayoutConfig.IdePosition.fromConfigValue(idePositionRaw.get());
            if (parsed.isPresent()) {
                idePosition = parsed.get();
            } else {
                findings.add(ConfigFinding.fail(
                    "layout.idePosition must be \"left\" or \"right\"",
                    "Got \"" + idePositionRaw.get() + "\".",
                    "Set idePosition to \"left\" or \"right\" (default: \"left\")."
                ));
                valid = false;
            }
        }

        LayoutConfig.Justification justification = LayoutConfig.DEFAULT_JUSTIFICATION;
        if (justificationRaw.isPresent()) {
            Optional<LayoutConfig.Justification> parsed = LayoutConfig.Justification.fromConfigValue(justificationRaw.get());
            if (parsed.isPresent()) {
                justification = parsed.get();
            } else {
                findings.add(ConfigFinding.fail(
                    "layout.justification must be \"left\" or \"right\"",
                    "Got \"" + justificationRaw.get() + "\".",
                    "Set justification to \"left\" or \"right\" (default: \"right\")."
                ));
                valid = false;
            }
        }

        if (maxGap.isPresent() && (maxGap.get() < 0 || maxGap.get() > 100)) {
            findings.add(ConfigFinding.fail(
                "layout.maxGap must be 0–100",
                "Got " + maxGap.get() + ".",
                "Set maxGap to a value between 0 and 100 (default: 10)."
            ));
            valid = false;
        }

        if (!valid) {
            return LayoutConfig.defaults();
        }
        return new LayoutConfig(
            smallScreenThreshold.orElse(LayoutConfig.DEFAULT_SMALL_SCREEN_THRESHOLD),
            windowHeight.map(Long::intValue).orElse(LayoutConfig.DEFAULT_WINDOW_HEIGHT),
            maxWindowWidth.orElse(LayoutConfig.DEFAULT_MAX_WINDOW_WIDTH),
            idePosition,
            justification,
            maxGap.map(Long::intValue).orElse(LayoutConfig.DEFAULT_MAX_GAP)
        );
    }

    /**
     * Resolves a top-level section: absent yields empty silently, a non-table value is a failure.
     */
    private static Optional<TomlValue.TableValue> sectionTable(
        TomlValue.TableValue root,
        String key,
        List<ConfigFinding> findings
    ) {
        Optional<TomlValue> raw = root.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        if (raw.get() instanceof TomlValue.TableValue table) {
            return Optional.of(table);
        }
        findings.add(ConfigFinding.fail("[" + key + "] must be a table", "Use [" + key + "] as a TOML table section."));
        return Optional.empty();
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
