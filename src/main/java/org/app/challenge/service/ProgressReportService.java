package org.app.challenge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.app.challenge.model.CategoryProgress;
import org.app.challenge.model.Classification;
import org.app.challenge.model.DeploymentProfile;
import org.app.challenge.model.OwaspCategory;
import org.app.challenge.model.ProgressReport;
import org.app.challenge.model.Scenario;
import org.app.challenge.model.SolveState;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only OWASP Top 10 progress report over the current solve state.
 */
@RequiredArgsConstructor
public class ProgressReportService {

    private final ScenarioRegistry registry;
    private final EnablementResolver resolver;
    private final ActiveProfileSource profileSource;
    private final SolveStateStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ProgressReport generate() {
        DeploymentProfile profile = profileSource.currentProfile();
        Map<OwaspCategory, List<Scenario>> byCategory = new EnumMap<>(OwaspCategory.class);
        for (OwaspCategory c : OwaspCategory.values()) {
            byCategory.put(c, new ArrayList<>());
        }

        int solvedTotal = 0;
        int unmapped = 0;
        for (Scenario s : registry.all()) {
            if (store.isSolved(s.getKey())) solvedTotal++;
            if (s.getOwasp().isPresent()) {
                byCategory.get(s.getOwasp().get()).add(s);
            } else {
                unmapped++;
            }
        }

        List<CategoryProgress> categories = new ArrayList<>();
        int withActive = 0;
        int covered = 0;
        for (Map.Entry<OwaspCategory, List<Scenario>> e : byCategory.entrySet()) {
            CategoryProgress cp = summarize(e.getKey(), e.getValue(), profile);
            if (cp.active() > 0) withActive++;
            if (cp.covered()) covered++;
            categories.add(cp);
        }
        int score = withActive == 0 ? 0 : Math.round(covered * 100f / withActive);

        return new ProgressReport(clock.instant(), List.copyOf(profile.getNames()), score,
                registry.size(), solvedTotal, unmapped, categories);
    }

    private CategoryProgress summarize(OwaspCategory category, List<Scenario> scenarios, DeploymentProfile profile) {
        int active = 0;
        int solvedActive = 0;
        int suspect = 0;
        List<String> solvedKeys = new ArrayList<>();
        List<String> suspectKeys = new ArrayList<>();
        for (Scenario s : scenarios) {
            boolean isActive = resolver.isActive(s, profile);
            SolveState state = store.snapshot(s.getKey());
            if (isActive) active++;
            if (!state.isSolved()) continue;
            if (isActive) solvedActive++;
            solvedKeys.add(s.getKey());
            if (state.getClassification() == Classification.SUSPECT) {
                suspect++;
                suspectKeys.add(s.getKey());
            }
        }
        boolean covered = active > 0 && solvedActive == active;
        return new CategoryProgress(category.getCode(), category.getTitle(), scenarios.size(), active,
                solvedKeys.size(), suspect, covered, solvedKeys, suspectKeys);
    }

    public String renderJson(ProgressReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String renderMarkdown(ProgressReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("# OWASP Top 10 Training Progress\n\n");
        sb.append("**Generated:** ").append(report.generatedAt()).append('\n');
        sb.append("**Active profile:** ")
                .append(report.activeProfile().isEmpty() ? "(default)" : String.join(", ", report.activeProfile()))
                .append('\n');
        sb.append("**Coverage score:** ").append(report.coverageScore()).append("%\n");
        sb.append("**Solved:** ").append(report.solvedScenarios()).append(" of ").append(report.totalScenarios())
                .append(" scenarios\n\n");

        sb.append("| OWASP Category | Status | Active | Solved | Suspect |\n");
        sb.append("|----------------|--------|--------|--------|---------|\n");
        for (CategoryProgress c : report.categories()) {
            String status = c.active() == 0 ? "n/a" : c.covered() ? "covered" : "open";
            sb.append("| ").append(c.code()).append(' ').append(c.title())
                    .append(" | ").append(status)
                    .append(" | ").append(c.active())
                    .append(" | ").append(c.solved())
                    .append(" | ").append(c.suspect())
                    .append(" |\n");
        }

        sb.append("\n## Solved Scenarios\n\n");
        boolean any = false;
        for (CategoryProgress c : report.categories()) {
            if (c.solvedScenarios().isEmpty()) continue;
            any = true;
            sb.append("### ").append(c.code()).append(": ").append(c.title()).append("\n\n");
            for (String key : c.solvedScenarios()) {
                sb.append("- **").append(key).append("**");
                if (c.suspectScenarios().contains(key)) sb.append(" (suspect, review)");
                sb.append('\n');
            }
            sb.append('\n');
        }
        if (!any) sb.append("No scenarios solved yet.\n");
        return sb.toString();
    }
}
