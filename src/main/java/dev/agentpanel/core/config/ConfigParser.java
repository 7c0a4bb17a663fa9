package dev.agentpanel.core.config;

import dev.agentpanel.core.shared.Result;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns config.toml text into a typed {@link Config} plus findings.
 *
 * <p>Only a TOML syntax error yields an empty config. Semantic problems are reported as findings:
 * global sections fall back to their defaults and invalid projects are left out.
 */
public final class ConfigParser {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigParser.class);

    static final Set<String> KNOWN_TOP_LEVEL_KEYS = Set.of("app", "agentLayer", "chrome", "layout", "project");
    static final Set<String> KNOWN_APP_KEYS = Set.of("autoStartAtLogin");
    static final Set<String> KNOWN_AGENT_LAYER_KEYS = Set.of("enabled");
    static final Set<String> KNOWN_CHROME_KEYS = Set.of("pinnedTabs", "defaultTabs", "openGitRemote");
    static final Set<String> KNOWN_LAYOUT_KEYS = Set.of(
        "smallScreenThreshold", "windowHeight", "maxWindowWidth", "idePosition", "justification", "maxGap"
    );
    static final Set<String> KNOWN_PROJECT_KEYS = Set.of(
        "name", "remote", "path", "color", "useAgentLayer", "chromePinnedTabs", "chromeDefaultTabs"
    );

    private ConfigParser() {}

    public static ConfigLoadResult parse(String toml) {
        Result<TomlValue.TableValue, String> document = TomlDocuments.parse(toml);
        if (document.isErr()) {
            LOG.debug("config.toml syntax error: {}", document.error());
            return ConfigLoadResult.parseError(ConfigFinding.fail(
                "Config TOML parse error",
                document.error(),
                "Fix the TOML syntax in config.toml."
            ));
        }
        return parse(document.value());
    }

    static ConfigLoadResult parse(TomlValue.TableValue root) {
        List<ConfigFinding> findings = new ArrayList<>();

        FieldReaders.checkForUnknownKeys(root, KNOWN_TOP_LEVEL_KEYS, "top-level", findings);

        AppConfig app = GlobalSectionParsers.parseApp(root, findings);
        ChromeConfig chrome = GlobalSectionParsers.parseChrome(root, findings);
        AgentLayerConfig agentLayer = GlobalSectionParsers.parseAgentLayer(root, findings);
        LayoutConfig layout = GlobalSectionParsers.parseLayout(root, findings);
        List<ProjectConfig> projects = ProjectSectionParser.parseProjects(root, agentLayer.enabled(), findings);

        Config config = new Config(app, agentLayer, chrome, layout, projects);
        if (LOG.isDebugEnabled()) {
            long failures = findings.stream().filter(ConfigFinding::isFailure).count();
            LOG.debug("Parsed config: {} project(s), {} finding(s), {} failure(s)", projects.size(), findings.size(), failures);
        }
        return ConfigLoadResult.parsed(config, findings);
    }
}
