package dev.agentpanel.core.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tolerant typed accessors over a {@link TomlValue.TableValue}.
 *
 * <p>Each reader appends at most one finding per call (the array reader one per bad element)
 * and returns either the decoded value or an absence/default. None of them throws.
 */
final class FieldReaders {
    private FieldReaders() {}

    /**
     * Required string: missing, non-string and blank values are failures. Returns the trimmed value.
     */
    static Optional<String> readNonEmptyString(
        TomlValue.TableValue table,
        String key,
        String label,
        List<ConfigFinding> findings
    ) {
        Optional<TomlValue> raw = table.get(key);
        if (raw.isEmpty()) {
            findings.add(ConfigFinding.fail(label + " is missing", "Set " + label + " to a non-empty string."));
            return Optional.empty();
        }
        return decodeNonEmptyString(raw.get(), label, findings);
    }

    /**
     * Optional string: absence is silent, otherwise the same checks as {@link #readNonEmptyString}.
     */
    static Optional<String> readOptionalNonEmptyString(
        TomlValue.TableValue table,
        String key,
        String label,
        List<ConfigFinding> findings
    ) {
        return table.get(key).flatMap(raw -> decodeNonEmptyString(raw, label, findings));
    }

    private static Optional<String> decodeNonEmptyString(TomlValue raw, String label, List<ConfigFinding> findings) {
        if (!(raw instanceof TomlValue.StringValue str)) {
            findings.add(ConfigFinding.fail(label + " must be a string", gotType(raw), "Set " + label + " to a non-empty string."));
            return Optional.empty();
        }
        String trimmed = str.value().strip();
        if (trimmed.isEmpty()) {
            findings.add(ConfigFinding.fail(label + " is empty", "Set " + label + " to a non-empty string."));
            return Optional.empty();
        }
        return Optional.of(trimmed);
    }

    static boolean readOptionalBool(
        TomlValue.TableValue table,
        String key,
        boolean defaultValue,
        String label,
        List<ConfigFinding> findings
    ) {
        Optional<TomlValue> raw = table.get(key);
        if (raw.isEmpty()) {
            return defaultValue;
        }
        if (raw.get() instanceof TomlValue.BoolValue bool) {
            return bool.value();
        }
        findings.add(ConfigFinding.fail(label + " must be a boolean", gotType(raw.get()), "Set " + label + " to true or false."));
        return defaultValue;
    }

    /**
     * Number field: TOML integers are widened, so {@code 24} and {@code 24.0} are both accepted.
     */
    static Optional<Double> readOptionalNumber(
        TomlValue.TableValue table,
        String key,
        String label,
        List<ConfigFinding> findings
    ) {
        Optional<TomlValue> raw = table.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        if (raw.get() instanceof TomlValue.IntegerValue integer) {
            return Optional.of((double) integer.value());
        }
        if (raw.get() instanceof TomlValue.FloatValue number) {
            return Optional.of(number.value());
        }
        findings.add(ConfigFinding.fail(label + " must be a number", gotType(raw.get()), "Set " + label + " to a numeric value."));
        return Optional.empty();
    }

    /**
     * Integer field: floats are rejected, even integral ones such as {@code 90.0}.
     */
    static Optional<Long> readOptionalInteger(
        TomlValue.TableValue table,
        String key,
        String label,
        List<ConfigFinding> findings
    ) {
        Optional<TomlValue> raw = table.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        if (raw.get() instanceof TomlValue.IntegerValue integer) {
            return Optional.of(integer.value());
        }
        findings.add(ConfigFinding.fail(label + " must be an integer", gotType(raw.get()), "Set " + label + " to a whole number."));
        return Optional.empty();
    }

    /**
     * String array: non-string elements are reported per index and skipped; the rest are kept in order.
     */
    static List<String> readOptionalStringArray(
        TomlValue.TableValue table,
        String key,
        String label,
        List<ConfigFinding> findings
    ) {
        Optional<TomlValue> raw = table.get(key);
        if (raw.isEmpty()) {
            return List.of();
        }
        if (!(raw.get() instanceof TomlValue.ArrayValue array)) {
            findings.add(ConfigFinding.fail(
                label + " must be an array of strings",
                gotType(raw.get()),
                "Set " + label + " to an array of strings, e.g. [\"https://example.com\"]."
            ));
            return List.of();
        }
        List<String> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            if (array.get(i) instanceof TomlValue.StringValue str) {
                values.add(str.value());
            } else {
                findings.add(ConfigFinding.fail(
                    label + "[" + i + "] must be a string",
                    gotType(array.get(i)),
                    "Ensure all elements in " + label + " are strings."
                ));
            }
        }
        return values;
    }

    /**
     * Every URL must start with {@code http://} or {@code https://} after trimming.
     *
     * @return {@code true} when all URLs pass
     */
    static boolean validateUrls(List<String> urls, String label, List<ConfigFinding> findings) {
        boolean allValid = true;
        for (int i = 0; i < urls.size(); i++) {
            String trimmed = urls.get(i).strip();
            if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
                findings.add(ConfigFinding.fail(
                    label + "[" + i + "] is not a valid URL",
                    "Got \"" + trimmed + "\". URLs must start with http:// or https://.",
                    "Use a full URL starting with http:// or https://."
                ));
                allValid = false;
            }
        }
        return allValid;
    }

    /**
     * Emits one warning per key outside {@code knownKeys}, in key order.
     */
    static void checkForUnknownKeys(
        TomlValue.TableValue table,
        Set<String> knownKeys,
        String section,
        List<ConfigFinding> findings
    ) {
        Set<String> unknown = new TreeSet<>(table.keys());
        unknown.removeAll(knownKeys);
        if (unknown.isEmpty()) {
            return;
        }
        String known = String.join(", ", new TreeSet<>(knownKeys));
        for (String key : unknown) {
            findings.add(ConfigFinding.warn(
                "Unrecognized " + section + " config key: " + key,
                null,
                "Remove '" + key + "' from config.toml. Known " + section + " keys are: " + known + "."
            ));
        }
    }

    private static String gotType(TomlValue value) {
        return "Got " + value.typeName() + ".";
    }
}
