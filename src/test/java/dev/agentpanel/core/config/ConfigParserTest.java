package dev.agentpanel.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConfigParserTest {
    @Test
    void syntaxErrorYieldsNoConfigAndASingleFailure() {
        ConfigLoadResult result = ConfigParser.parse("[[project]\nname = ");

        assertTrue(result.hasParseError());
        assertTrue(result.config().isEmpty());
        assertEquals(List.of(), result.projects());
        assertEquals(1, result.findings().size());
        ConfigFinding finding = result.findings().get(0);
        assertEquals(FindingSeverity.FAIL, finding.severity());
        assertEquals("Config TOML parse error", finding.title());
        assertTrue(finding.detail().isPresent());
    }

    @Test
    void pathologicallyNestedArraysAreAParseError() {
        ConfigLoadResult result = ConfigParser.parse("x = " + "[".repeat(20000) + "]".repeat(20000));

        assertTrue(result.hasParseError());
        assertTrue(result.config().isEmpty());
        assertEquals(List.of("Config TOML parse error"), result.findings().stream().map(ConfigFinding::title).toList());
    }

    @Test
    void nestingBeyondTheLimitIsAParseError() {
        int depth = TomlDocuments.MAX_NESTING_DEPTH + 10;
        ConfigLoadResult result = ConfigParser.parse("x = " + "[".repeat(depth) + "]".repeat(depth));

        assertTrue(result.hasParseError());
        assertTrue(result.findings().get(0).detail().orElseThrow().contains("deeper than"));
    }

    @Test
    void emptyDocumentIsAllDefaultsWithAWarning() {
        ConfigLoadResult result = ConfigParser.parse("");

        assertFalse(result.hasParseError());
        assertFalse(result.hasFailures());
        Config config = result.config().orElseThrow();
        assertEquals(AppConfig.defaults(), config.app());
        assertEquals(LayoutConfig.defaults(), config.layout());
        assertEquals(List.of(), config.projects());
        assertEquals(List.of("No [[project]] entries"), result.findings().stream().map(ConfigFinding::title).toList());
    }

    @Test
    void starterTemplateParsesWithoutFailures() {
        ConfigLoadResult result = ConfigParser.parse(StarterConfig.TEMPLATE);
        assertTrue(result.config().isPresent());
        assertFalse(result.hasFailures());
    }

    @Test
    void keepsValidProjectsInDeclarationOrderNextToInvalidOnes() {
        ConfigLoadResult result = ConfigParser.parse(String.join("\n",
            "[[project]]",
            "name = \"Zeta\"",
            "path = \"/z\"",
            "color = \"red\"",
            "",
            "[[project]]",
            "name = \"Broken\"",
            "path = \"relative\"",
            "color = \"red\"",
            "",
            "[[project]]",
            "name = \"Alpha\"",
            "path = \"/a\"",
            "color = \"#00FF00\""
        ));

        assertEquals(List.of("zeta", "alpha"), result.projects().stream().map(ProjectConfig::id).toList());
        assertEquals(result.projects(), result.config().orElseThrow().projects());
        assertEquals(1, result.failures().size());
    }

    @Test
    void configIsPresentEvenWhenFindingsFail() {
        ConfigLoadResult result = ConfigParser.parse("[layout]\nwindowHeight = 0\n");
        assertTrue(result.hasFailures());
        assertEquals(LayoutConfig.defaults(), result.config().orElseThrow().layout());
    }

    @Test
    void unknownTopLevelKeyIsAWarning() {
        ConfigLoadResult result = ConfigParser.parse("theme = \"dark\"\n");
        assertFalse(result.hasFailures());
        assertTrue(result.findings().stream()
            .anyMatch(finding -> finding.title().equals("Unrecognized top-level config key: theme")));
    }

    @Test
    void globalAgentLayerFlowsIntoProjects() {
        ConfigLoadResult result = ConfigParser.parse(String.join("\n",
            "[agentLayer]",
            "enabled = true",
            "[[project]]",
            "name = \"App\"",
            "path = \"/app\"",
            "color = \"blue\""
        ));
        assertTrue(result.projects().get(0).useAgentLayer());
    }
}
