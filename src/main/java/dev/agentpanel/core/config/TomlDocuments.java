package dev.agentpanel.core.config;

import dev.agentpanel.core.shared.Result;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Syntax layer: runs tomlj and converts its tree into {@link TomlValue}s.
 */
final class TomlDocuments {
    /**
     * Deepest array/table nesting accepted; config.toml itself never goes beyond three levels.
     */
    static final int MAX_NESTING_DEPTH = 64;

    private TomlDocuments() {}

    /**
     * Parses TOML text; the error side carries the first syntax error as reported by tomlj.
     */
    static Result<TomlValue.TableValue, String> parse(String text) {
        TomlParseResult result;
        try {
            result = Toml.parse(text == null ? "" : text);
        } catch (StackOverflowError ex) {
            // tomlj's lexer recurses once per open bracket or brace.
            return Result.err(nestingTooDeep());
        }
        if (result.hasErrors()) {
            return Result.err(result.errors().get(0).toString());
        }
        try {
            return Result.ok(convertTable(result, 0));
        } catch (NestingTooDeepException ex) {
            return Result.err(nestingTooDeep());
        }
    }

    private static String nestingTooDeep() {
        return "Document nests arrays or tables deeper than " + MAX_NESTING_DEPTH + " levels";
    }

    private static TomlValue.TableValue convertTable(TomlTable table, int depth) {
        if (depth > MAX_NESTING_DEPTH) {
            throw new NestingTooDeepException();
        }
        Map<String, TomlValue> entries = new LinkedHashMap<>();
        // Path lookup, so quoted keys containing dots are not split.
        for (String key : table.keySet()) {
            entries.put(key, convertValue(table.get(List.of(key)), depth + 1));
        }
        return new TomlValue.TableValue(entries);
    }

    private static TomlValue convertValue(Object value, int depth) {
        if (value instanceof TomlTable table) {
            return convertTable(table, depth);
        }
        if (value instanceof TomlArray array) {
            if (depth > MAX_NESTING_DEPTH) {
                throw new NestingTooDeepException();
            }
            List<TomlValue> elements = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                elements.add(convertValue(array.get(i), depth + 1));
            }
            return new TomlValue.ArrayValue(elements);
        }
        if (value instanceof String str) {
            return new TomlValue.StringValue(str);
        }
        if (value instanceof Boolean bool) {
            return new TomlValue.BoolValue(bool);
        }
        if (value instanceof Long number) {
            return new TomlValue.IntegerValue(number);
        }
        if (value instanceof Double number) {
            return new TomlValue.FloatValue(number);
        }
        if (value instanceof TemporalAccessor temporal) {
            return new TomlValue.TemporalValue(temporal.toString());
        }
        throw new IllegalStateException("Unexpected TOML value type: " + (value == null ? "null" : value.getClass().getName()));
    }

    private static final class NestingTooDeepException extends RuntimeException {
        NestingTooDeepException() {
            super(null, null, false, false);
        }
    }
}
