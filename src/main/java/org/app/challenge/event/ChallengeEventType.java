package org.app.challenge.event;

public enum ChallengeEventType {
    SOLVED,
    HINT_UNLOCKED
}
