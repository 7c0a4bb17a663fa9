package dev.agentpanel.core.switcher;

import dev.agentpanel.core.config.ProjectConfig;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orders and filters projects for the switcher.
 *
 * <p>Empty query: most recently activated first, then config order. Non-empty query: only
 * projects whose name or id contains the query, ranked name-prefix, id-prefix, name-substring,
 * id-substring, then by recency and config order.
 */
public final class ProjectSorter {
    private ProjectSorter() {}

    private enum MatchTier {
        NAME_PREFIX,
        ID_PREFIX,
        NAME_INFIX,
        ID_INFIX
    }

    private record Candidate(ProjectConfig project, MatchTier tier, int recency, int configOrder) {}

    /**
     * @param projects all projects in config order
     * @param query search text, trimmed and matched case-insensitively
     * @param recentActivations focus history, newest first
     */
    public static List<ProjectConfig> sortedProjects(
        List<ProjectConfig> projects,
        String query,
        List<FocusEvent> recentActivations
    ) {
        String trimmedQuery = query == null ? "" : query.strip().toLowerCase(Locale.ROOT);

        Map<String, Integer> recencyRank = new HashMap<>();
        for (int i = 0; i < recentActivations.size(); i++) {
            int rank = i;
            recentActivations.get(i).projectId().ifPresent(id -> recencyRank.putIfAbsent(id, rank));
        }
        int noHistoryRank = recentActivations.size();

        List<Candidate> candidates = new ArrayList<>(projects.size());
        for (int i = 0; i < projects.size(); i++) {
            ProjectConfig project = projects.get(i);
            int recency = recencyRank.getOrDefault(project.id(), noHistoryRank);
            if (trimmedQuery.isEmpty()) {
                candidates.add(new Candidate(project, MatchTier.NAME_PREFIX, recency, i));
                continue;
            }
            MatchTier tier = matchTier(project, trimmedQuery);
            if (tier != null) {
                candidates.add(new Candidate(project, tier, recency, i));
            }
        }

        candidates.sort(Comparator.comparing(Candidate::tier)
            .thenComparingInt(Candidate::recency)
            .thenComparingInt(Candidate::configOrder));
        return candidates.stream().map(Candidate::project).toList();
    }

    /**
     * @return the best tier, or {@code null} when neither name nor id contains the query
     */
    private static MatchTier matchTier(ProjectConfig project, String query) {
        String name = project.name().toLowerCase(Locale.ROOT);
        String id = project.id().toLowerCase(Locale.ROOT);
        if (name.startsWith(query)) {
            return MatchTier.NAME_PREFIX;
        }
        if (id.startsWith(query)) {
            return MatchTier.ID_PREFIX;
        }
        if (name.contains(query)) {
            return MatchTier.NAME_INFIX;
        }
        if (id.contains(query)) {
            return MatchTier.ID_INFIX;
        }
        return null;
    }
}
