package org.app.challenge.model;

import java.time.Instant;
import java.util.Optional;

public class HintState {
    private final String scenarioKey;
    private final int unlockedCount;
    private final int totalHints;
    private final Instant lastUnlockAt;

    public HintState(String scenarioKey, int unlockedCount, int totalHints, Instant lastUnlockAt) {
        this.scenarioKey = scenarioKey;
        this.unlockedCount = unlockedCount;
        this.totalHints = totalHints;
        this.lastUnlockAt = lastUnlockAt;
    }

    public String getScenarioKey() { return scenarioKey; }
    public int getUnlockedCount() { return unlockedCount; }
    public int getTotalHints() { return totalHints; }
    public Optional<Instant> getLastUnlockAt() { return Optional.ofNullable(lastUnlockAt); }
}
