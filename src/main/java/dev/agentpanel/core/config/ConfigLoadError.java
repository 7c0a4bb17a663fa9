package dev.agentpanel.core.config;

import dev.agentpanel.core.api.ApCoreError;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Single error type for callers that only accept a fully valid {@link Config}.
 */
public sealed interface ConfigLoadError {

    ApCoreError toApCoreError();

    record FileNotFound(String path) implements ConfigLoadError {
        @Override
        public ApCoreError toApCoreError() {
            return ApCoreError.configuration("Config file not found", path);
        }
    }

    record ReadFailed(String path, String detail) implements ConfigLoadError {
        @Override
        public ApCoreError toApCoreError() {
            return ApCoreError.fileSystem("Config file could not be read: " + path, detail);
        }
    }

    record ParseFailed(String detail) implements ConfigLoadError {
        @Override
        public ApCoreError toApCoreError() {
            return ApCoreError.parse("Config file is not valid TOML", detail);
        }
    }

    record ValidationFailed(List<ConfigFinding> findings) implements ConfigLoadError {
        public ValidationFailed {
            findings = List.copyOf(findings);
        }

        @Override
        public ApCoreError toApCoreError() {
            String titles = findings.stream().map(ConfigFinding::title).collect(Collectors.joining("; "));
            return ApCoreError.validation(
                "Config validation failed (" + findings.size() + " issue" + (findings.size() == 1 ? "" : "s") + ")",
                titles
            );
        }
    }
}
