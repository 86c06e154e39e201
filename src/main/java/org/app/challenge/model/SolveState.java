package org.app.challenge.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of a scenario's solve progress.
 */
public class SolveState {
    private final String scenarioKey;
    private final Instant solvedAt;
    private final Classification classification;
    private final int attemptCount;

    public SolveState(String scenarioKey, Instant solvedAt, Classification classification, int attemptCount) {
        this.scenarioKey = scenarioKey;
        this.solvedAt = solvedAt;
        this.classification = classification;
        this.attemptCount = attemptCount;
    }

    public String getScenarioKey() { return scenarioKey; }
    public boolean isSolved() { return solvedAt != null; }
    public Optional<Instant> getSolvedAt() { return Optional.ofNullable(solvedAt); }
    public Classification getClassification() { return classification; }
    public int getAttemptCount() { return attemptCount; }
}
