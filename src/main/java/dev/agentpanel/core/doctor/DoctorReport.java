package dev.agentpanel.core.doctor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.agentpanel.core.config.ConfigFinding;
import dev.agentpanel.core.config.FindingSeverity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Findings ordered for display (FAIL, WARN, PASS; original order within a severity).
 */
public record DoctorReport(String configPath, List<ConfigFinding> findings) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public DoctorReport {
        List<ConfigFinding> sorted = new ArrayList<>(findings);
        sorted.sort(Comparator.comparingInt(finding -> finding.severity().sortOrder()));
        findings = List.copyOf(sorted);
    }

    public boolean hasFailures() {
        return findings.stream().anyMatch(ConfigFinding::isFailure);
    }

    public long count(FindingSeverity severity) {
        return findings.stream().filter(finding -> finding.severity() == severity).count();
    }

    public String renderText() {
        StringBuilder out = new StringBuilder();
        out.append("AgentPanel config: ").append(configPath).append('\n');
        for (ConfigFinding finding : findings) {
            out.append(String.format("%-5s %s\n", finding.severity().name(), finding.title()));
            finding.detail().ifPresent(detail -> out.append("  Detail: ").append(detail).append('\n'));
            finding.fix().ifPresent(fix -> out.append("  Fix: ").append(fix).append('\n'));
        }
        out.append(String.format(
            "%d fail, %d warn, %d pass\n",
            count(FindingSeverity.FAIL),
            count(FindingSeverity.WARN),
            count(FindingSeverity.PASS)
        ));
        return out.toString();
    }

    public Map<String, Object> toSerializableMap() {
        List<Map<String, Object>> items = new ArrayList<>();
        for (ConfigFinding finding : findings) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("severity", finding.severity().name());
            item.put("title", finding.title());
            finding.detail().ifPresent(detail -> item.put("detail", detail));
            finding.fix().ifPresent(fix -> item.put("fix", fix));
            items.add(item);
        }
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("configPath", configPath);
        serializable.put("ok", !hasFailures());
        serializable.put("findings", items);
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize doctor report: " + ex.getOriginalMessage(), ex);
        }
    }
}
