package dev.agentpanel.core.config;

import dev.agentpanel.core.identity.IdNormalizer;
import dev.agentpanel.core.remote.RemoteAuthority;
import dev.agentpanel.core.remote.RemoteAuthorityError;
import dev.agentpanel.core.shared.Result;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parses the {@code [[project]]} array. Unlike the global sections, an invalid entry is dropped
 * rather than defaulted: there is no sensible default for a project identity.
 */
final class ProjectSectionParser {
    private static final String REMOTE_FORMAT_FIX = "Use format: remote = \"ssh-remote+user@host\"";

    private ProjectSectionParser() {}

    /**
     * Returns the valid projects in declaration order.
     */
    static List<ProjectConfig> parseProjects(
        TomlValue.TableValue root,
        boolean globalAgentLayerEnabled,
        List<ConfigFinding> findings
    ) {
        Optional<TomlValue> raw = root.get("project");
        if (raw.isEmpty()) {
            findings.add(noProjectsFinding());
            return List.of();
        }
        if (!(raw.get() instanceof TomlValue.ArrayValue entries)) {
            findings.add(ConfigFinding.fail("project must be an array of tables", "Use [[project]] entries in config.toml."));
            return List.of();
        }
        if (entries.size() == 0) {
            findings.add(noProjectsFinding());
            return List.of();
        }

        List<ProjectConfig> projects = new ArrayList<>();
        Map<String, Integer> seenIds = new HashMap<>();
        for (int index = 0; index < entries.size(); index++) {
            if (!(entries.get(index) instanceof TomlValue.TableValue table)) {
                findings.add(ConfigFinding.fail(
                    "project[" + index + "] must be a table",
                    "Ensure each [[project]] entry is a TOML table."
                ));
                continue;
            }
            parseProject(table, index, globalAgentLayerEnabled, seenIds, findings).ifPresent(projects::add);
        }
        return projects;
    }

    static Optional<ProjectConfig> parseProject(
        TomlValue.TableValue table,
        int index,
        boolean globalAgentLayerEnabled,
        Map<String, Integer> seenIds,
        List<ConfigFinding> findings
    ) {
        String prefix = "project[" + index + "]";
        boolean valid = true;

        FieldReaders.checkForUnknownKeys(table, ConfigParser.KNOWN_PROJECT_KEYS, "[[project]]", findings);

        Optional<String> name = FieldReaders.readNonEmptyString(table, "name", prefix + ".name", findings);
        Optional<String> remote = FieldReaders.readOptionalNonEmptyString(table, "remote", prefix + ".remote", findings);
        Optional<String> path = FieldReaders.readNonEmptyString(table, "path", prefix + ".path", findings);
        Optional<String> color = FieldReaders.readNonEmptyString(table, "color", prefix + ".color", findings);
        boolean useAgentLayer =
            FieldReaders.readOptionalBool(table, "useAgentLayer", globalAgentLayerEnabled, prefix + ".useAgentLayer", findings);

        Optional<String> id = name.flatMap(value -> deriveId(value, index, seenIds, findings));
        if (id.isEmpty()) {
            valid = false;
        }

        Optional<String> normalizedColor = color.flatMap(value -> normalizeColor(value, prefix, findings));
        if (normalizedColor.isEmpty()) {
            valid = false;
        }

        if (path.isPresent() && containsControlCharacter(path.get())) {
            findings.add(ConfigFinding.fail(
                prefix + ".path must not contain control characters",
                "Remove escapes such as \\u0000 from the path."
            ));
            valid = false;
        }

        Optional<String> validRemote = Optional.empty();
        if (remote.isPresent()) {
            Result<String, RemoteAuthorityError> parsed = RemoteAuthority.parse(remote.get());
            if (parsed.isOk()) {
                validRemote = remote;
            } else {
                findings.add(ConfigFinding.fail(prefix + ".remote: " + remoteErrorTitle(parsed.error()), REMOTE_FORMAT_FIX));
                valid = false;
            }
        }

        if (validRemote.isPresent()) {
            if (useAgentLayer) {
                findings.add(ConfigFinding.fail(
                    prefix + ": Agent Layer is not supported with SSH projects",
                    "Set useAgentLayer = false for this project (SSH projects cannot use Agent Layer)."
                ));
                valid = false;
            }
            if (path.isPresent() && !path.get().startsWith("/")) {
                findings.add(ConfigFinding.fail(
                    prefix + ".path: remote path must be an absolute path (starting with /)",
                    "Use a remote absolute path, e.g. /Users/you/src/project"
                ));
                valid = false;
            }
        } else if (path.isPresent()) {
            if (path.get().startsWith(RemoteAuthority.PREFIX)) {
                findings.add(ConfigFinding.fail(
                    prefix + ".path: legacy SSH path format is not supported",
                    "Found an ssh-remote+ prefix in project.path but project.remote is not set.",
                    "Use remote = \"ssh-remote+user@host\" and path = \"/remote/absolute/path\""
                ));
                valid = false;
            } else if (!path.get().startsWith("/")) {
                findings.add(ConfigFinding.fail(
                    prefix + ".path: local path must be an absolute path (starting with /)",
                    "Use an absolute path, e.g. /Users/you/src/project"
                ));
                valid = false;
            }
        }

        List<String> pinnedTabs = FieldReaders.readOptionalStringArray(table, "chromePinnedTabs", prefix + ".chromePinnedTabs", findings);
        if (!FieldReaders.validateUrls(pinnedTabs, prefix + ".chromePinnedTabs", findings)) {
            valid = false;
        }
        List<String> defaultTabs =
            FieldReaders.readOptionalStringArray(table, "chromeDefaultTabs", prefix + ".chromeDefaultTabs", findings);
        if (!FieldReaders.validateUrls(defaultTabs, prefix + ".chromeDefaultTabs", findings)) {
            valid = false;
        }

        if (!valid || path.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ProjectConfig(
            id.get(),
            name.get(),
            validRemote,
            path.get(),
            normalizedColor.get(),
            useAgentLayer,
            pinnedTabs,
            defaultTabs
        ));
    }

    /**
     * Normalizes the name into an id, rejecting empty, reserved and duplicate results.
     * Only accepted ids are recorded in {@code seenIds}.
     */
    private static Optional<String> deriveId(
        String name,
        int index,
        Map<String, Integer> seenIds,
        List<ConfigFinding> findings
    ) {
        String prefix = "project[" + index + "]";
        String normalized = IdNormalizer.normalize(name);
        if (normalized.isEmpty()) {
            findings.add(ConfigFinding.fail(
                prefix + ".name cannot derive an id",
                "Normalized id was empty after removing invalid characters.",
                "Use a name with letters or numbers so an id can be derived."
            ));
            return Optional.empty();
        }
        if (IdNormalizer.isReserved(normalized)) {
            findings.add(ConfigFinding.fail(
                prefix + ".id is reserved",
                "The id '" + normalized + "' is reserved.",
                "Choose a different project name so the derived id is not reserved."
            ));
            return Optional.empty();
        }
        Integer existing = seenIds.get(normalized);
        if (existing != null) {
            findings.add(ConfigFinding.fail(
                "Duplicate project.id: " + normalized,
                "Derived from project indexes " + existing + " and " + index + ".",
                "Ensure project names normalize to unique ids."
            ));
            return Optional.empty();
        }
        seenIds.put(normalized, index);
        return Optional.of(normalized);
    }

    /**
     * Hex colors are kept verbatim; palette names are lowercased.
     */
    private static Optional<String> normalizeColor(String color, String prefix, List<ConfigFinding> findings) {
        if (ProjectColorPalette.isValidHex(color)) {
            return Optional.of(color);
        }
        String lowered = color.toLowerCase(Locale.ROOT);
        if (ProjectColorPalette.isNamed(lowered)) {
            return Optional.of(lowered);
        }
        findings.add(ConfigFinding.fail(
            prefix + ".color is invalid",
            "Color must be #RRGGBB or a named color.",
            "Use a hex color or one of: " + String.join(", ", ProjectColorPalette.sortedNames()) + "."
        ));
        return Optional.empty();
    }

    private static boolean containsControlCharacter(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static String remoteErrorTitle(RemoteAuthorityError error) {
        switch (error) {
            case MISSING_PREFIX:
                return "SSH remote authority must start with 'ssh-remote+'";
            case CONTAINS_WHITESPACE:
                return "SSH remote authority must not contain whitespace";
            case MISSING_TARGET:
                return "SSH remote authority is missing host (expected ssh-remote+user@host)";
            case TARGET_STARTS_WITH_DASH:
                return "SSH remote authority must not start with '-'";
            default:
                throw new IllegalArgumentException("Unhandled remote authority error: " + error);
        }
    }

    private static ConfigFinding noProjectsFinding() {
        return ConfigFinding.warn(
            "No [[project]] entries",
            null,
            "Add at least one [[project]] entry to config.toml."
        );
    }
}
