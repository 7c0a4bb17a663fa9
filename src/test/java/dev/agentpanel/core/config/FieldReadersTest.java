package dev.agentpanel.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FieldReadersTest {
    private final List<ConfigFinding> findings = new ArrayList<>();

    private static TomlValue.TableValue table(Map<String, TomlValue> entries) {
        return new TomlValue.TableValue(entries);
    }

    @Test
    void requiredStringIsTrimmed() {
        var value = FieldReaders.readNonEmptyString(
            table(Map.of("name", new TomlValue.StringValue("  Demo  "))), "name", "project[0].name", findings);
        assertEquals(Optional.of("Demo"), value);
        assertTrue(findings.isEmpty());
    }

    @Test
    void requiredStringReportsMissingWrongTypeAndBlank() {
        FieldReaders.readNonEmptyString(TomlValue.TableValue.empty(), "name", "project[0].name", findings);
        FieldReaders.readNonEmptyString(table(Map.of("name", new TomlValue.IntegerValue(3))), "name", "project[1].name", findings);
        FieldReaders.readNonEmptyString(table(Map.of("name", new TomlValue.StringValue("   "))), "name", "project[2].name", findings);

        assertEquals(List.of("project[0].name is missing", "project[1].name must be a string", "project[2].name is empty"),
            findings.stream().map(ConfigFinding::title).toList());
        assertTrue(findings.stream().allMatch(ConfigFinding::isFailure));
    }

    @Test
    void optionalStringIsSilentWhenAbsent() {
        assertEquals(Optional.empty(),
            FieldReaders.readOptionalNonEmptyString(TomlValue.TableValue.empty(), "remote", "project[0].remote", findings));
        assertTrue(findings.isEmpty());
    }

    @Test
    void boolFallsBackToDefaultOnWrongType() {
        var section = table(Map.of("enabled", new TomlValue.StringValue("yes")));
        assertTrue(FieldReaders.readOptionalBool(section, "enabled", true, "agentLayer.enabled", findings));
        assertEquals("agentLayer.enabled must be a boolean", findings.get(0).title());
        assertFalse(FieldReaders.readOptionalBool(TomlValue.TableValue.empty(), "enabled", false, "agentLayer.enabled", findings));
        assertEquals(1, findings.size());
    }

    @Test
    void numberWidensIntegersButIntegerRejectsFloats() {
        var section = table(Map.of(
            "threshold", new TomlValue.IntegerValue(24),
            "height", new TomlValue.FloatValue(90.0)
        ));
        assertEquals(Optional.of(24.0), FieldReaders.readOptionalNumber(section, "threshold", "layout.threshold", findings));
        assertEquals(Optional.empty(), FieldReaders.readOptionalInteger(section, "height", "layout.windowHeight", findings));
        assertEquals("layout.windowHeight must be an integer", findings.get(0).title());
    }

    @Test
    void stringArrayKeepsValidElementsAndReportsEachBadOne() {
        var section = table(Map.of("tabs", new TomlValue.ArrayValue(List.of(
            new TomlValue.StringValue("https://a.example"),
            new TomlValue.IntegerValue(1),
            new TomlValue.StringValue("https://b.example"),
            new TomlValue.BoolValue(true)
        ))));
        List<String> values = FieldReaders.readOptionalStringArray(section, "tabs", "chrome.pinnedTabs", findings);

        assertEquals(List.of("https://a.example", "https://b.example"), values);
        assertEquals(List.of("chrome.pinnedTabs[1] must be a string", "chrome.pinnedTabs[3] must be a string"),
            findings.stream().map(ConfigFinding::title).toList());
    }

    @Test
    void nonArrayIsReportedOnce() {
        var section = table(Map.of("tabs", new TomlValue.StringValue("https://a.example")));
        assertEquals(List.of(), FieldReaders.readOptionalStringArray(section, "tabs", "chrome.pinnedTabs", findings));
        assertEquals("chrome.pinnedTabs must be an array of strings", findings.get(0).title());
    }

    @Test
    void urlValidationNamesTheIndex() {
        boolean valid = FieldReaders.validateUrls(List.of("https://ok.example", " ftp://nope "), "chrome.defaultTabs", findings);
        assertFalse(valid);
        assertEquals("chrome.defaultTabs[1] is not a valid URL", findings.get(0).title());
        assertEquals(Optional.of("Got \"ftp://nope\". URLs must start with http:// or https://."), findings.get(0).detail());
    }

    @Test
    void unknownKeysAreWarningsInKeyOrder() {
        var section = table(Map.of(
            "zeta", new TomlValue.BoolValue(true),
            "enabled", new TomlValue.BoolValue(true),
            "alpha", new TomlValue.BoolValue(true)
        ));
        FieldReaders.checkForUnknownKeys(section, Set.of("enabled"), "[agentLayer]", findings);

        assertEquals(List.of("Unrecognized [agentLayer] config key: alpha", "Unrecognized [agentLayer] config key: zeta"),
            findings.stream().map(ConfigFinding::title).toList());
        assertTrue(findings.stream().allMatch(finding -> finding.severity() == FindingSeverity.WARN));
    }
}
