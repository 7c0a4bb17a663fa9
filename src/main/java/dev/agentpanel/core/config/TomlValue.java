package dev.agentpanel.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view of a parsed TOML document. Field readers branch over these variants only, so every
 * lookup is total and never depends on the parser library's object model.
 */
sealed interface TomlValue {

    String typeName();

    record StringValue(String value) implements TomlValue {
        @Override
        public String typeName() {
            return "string";
        }
    }

    record IntegerValue(long value) implements TomlValue {
        @Override
        public String typeName() {
            return "integer";
        }
    }

    record FloatValue(double value) implements TomlValue {
        @Override
        public String typeName() {
            return "float";
        }
    }

    record BoolValue(boolean value) implements TomlValue {
        @Override
        public String typeName() {
            return "boolean";
        }
    }

    /**
     * Date, time or date-time literal, kept as its textual form.
     */
    record TemporalValue(String text) implements TomlValue {
        @Override
        public String typeName() {
            return "datetime";
        }
    }

    record ArrayValue(List<TomlValue> elements) implements TomlValue {
        public ArrayValue {
            elements = List.copyOf(elements);
        }

        public int size() {
            return elements.size();
        }

        public TomlValue get(int index) {
            return elements.get(index);
        }

        @Override
        public String typeName() {
            return "array";
        }
    }

    record TableValue(Map<String, TomlValue> entries) implements TomlValue {
        public TableValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public static TableValue empty() {
            return new TableValue(Map.of());
        }

        public boolean contains(String key) {
            return entries.containsKey(key);
        }

        public Optional<TomlValue> get(String key) {
            return Optional.ofNullable(entries.get(key));
        }

        public java.util.Set<String> keys() {
            return entries.keySet();
        }

        @Override
        public String typeName() {
            return "table";
        }
    }
}
