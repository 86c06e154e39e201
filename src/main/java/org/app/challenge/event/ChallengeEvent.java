package org.app.challenge.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.app.challenge.model.Classification;

import java.time.Instant;

/**
 * Notification fanned out to observers.
 * - SOLVED carries the classification assigned at solve time
 * - HINT_UNLOCKED carries the zero-based hint index and its text
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChallengeEvent {
    private final ChallengeEventType type;
    private final String scenarioKey;
    private final Instant timestamp;
    private final Classification classification;
    private final Integer hintIndex;
    private final String hintText;

    private ChallengeEvent(ChallengeEventType type, String scenarioKey, Instant timestamp,
                           Classification classification, Integer hintIndex, String hintText) {
        this.type = type;
        this.scenarioKey = scenarioKey;
        this.timestamp = timestamp;
        this.classification = classification;
        this.hintIndex = hintIndex;
        this.hintText = hintText;
    }

    public static ChallengeEvent solved(String scenarioKey, Instant solvedAt, Classification classification) {
        return new ChallengeEvent(ChallengeEventType.SOLVED, scenarioKey, solvedAt, classification, null, null);
    }

    public static ChallengeEvent hintUnlocked(String scenarioKey, Instant unlockedAt, int hintIndex, String hintText) {
        return new ChallengeEvent(ChallengeEventType.HINT_UNLOCKED, scenarioKey, unlockedAt, null, hintIndex, hintText);
    }

    public ChallengeEventType getType() { return type; }
    public String getScenarioKey() { return scenarioKey; }
    public Instant getTimestamp() { return timestamp; }
    public Classification getClassification() { return classification; }
    public Integer getHintIndex() { return hintIndex; }
    public String getHintText() { return hintText; }

    @Override
    public String toString() {
        return type + "[" + scenarioKey + (hintIndex != null ? ", hint=" + hintIndex : "") + "]";
    }
}
