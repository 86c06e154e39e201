package org.app.challenge.model;

import java.time.Instant;

/**
 * Finalized first solve handed to the persistence sink.
 */
public record SolveRecord(String scenarioKey, String scenarioName, int difficulty, Instant solvedAt,
                          Classification classification, int attemptCount) {
}
