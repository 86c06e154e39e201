package org.app.challenge.model;

import java.time.Instant;
import java.util.List;

public record ProgressReport(Instant generatedAt, List<String> activeProfile, int coverageScore,
                             int totalScenarios, int solvedScenarios, int unmappedScenarios,
                             List<CategoryProgress> categories) {
}
