package org.app.challenge.service;

import org.app.challenge.exception.ConfigException;
import org.app.challenge.model.Classification;
import org.app.challenge.model.InteractionEvent;
import org.app.challenge.support.EngineFixture;
import org.app.challenge.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.app.challenge.support.EngineFixture.scenario;
import static org.assertj.core.api.Assertions.*;

@DisplayName("AntiCheatCorrelator")
class AntiCheatCorrelatorTest {

    private final MutableClock clock = new MutableClock(EngineFixture.START);
    private final ScenarioRegistry registry = ScenarioRegistry.load(List.of(scenario("xss", null), scenario("idor", null)));
    private final AntiCheatCorrelator correlator = new AntiCheatCorrelator(registry, clock, 3, Duration.ofMinutes(10));

    @Test
    @DisplayName("Direct-path interactions only: suspect")
    void directPathOnlyIsSuspect() {
        correlator.recordInteraction("xss", false);
        correlator.recordInteraction("xss", false);
        correlator.recordInteraction("xss", false);

        assertThat(correlator.classifySolve("xss", clock.instant())).isEqualTo(Classification.SUSPECT);
    }

    @Test
    @DisplayName("No interactions at all: suspect")
    void noHistoryIsSuspect() {
        assertThat(correlator.classifySolve("idor", clock.instant())).isEqualTo(Classification.SUSPECT);
    }

    @Test
    @DisplayName("One intended-path interaction among direct ones: legitimate")
    void intendedPathIsLegitimate() {
        correlator.recordInteraction("xss", false);
        correlator.recordInteraction("xss", true);
        correlator.recordInteraction("xss", false);
        clock.advance(Duration.ofSeconds(5));

        assertThat(correlator.classifySolve("xss", clock.instant())).isEqualTo(Classification.LEGITIMATE);
    }

    @Test
    @DisplayName("History is per scenario")
    void perScenarioHistory() {
        correlator.recordInteraction("idor", true);

        assertThat(correlator.classifySolve("xss", clock.instant())).isEqualTo(Classification.SUSPECT);
        assertThat(correlator.classifySolve("idor", clock.instant())).isEqualTo(Classification.LEGITIMATE);
    }

    @Test
    @DisplayName("Intended interaction pushed out by newer ones no longer counts")
    void capacityEviction() {
        correlator.recordInteraction("xss", true);
        correlator.recordInteraction("xss", false);
        correlator.recordInteraction("xss", false);
        correlator.recordInteraction("xss", false);

        assertThat(correlator.recentInteractions("xss"))
                .hasSize(3)
                .noneMatch(InteractionEvent::viaIntendedPath);
        assertThat(correlator.classifySolve("xss", clock.instant())).isEqualTo(Classification.SUSPECT);
    }

    @Test
    @DisplayName("Intended interaction older than the window no longer counts")
    void ageEviction() {
        correlator.recordInteraction("xss", true);
        clock.advance(Duration.ofMinutes(11));

        assertThat(correlator.classifySolve("xss", clock.instant())).isEqualTo(Classification.SUSPECT);
    }

    @Test
    @DisplayName("Interactions after the solve instant are ignored")
    void laterInteractionsIgnored() {
        Instant solvedAt = clock.instant();
        clock.advance(Duration.ofSeconds(1));
        correlator.recordInteraction("xss", true);

        assertThat(correlator.classifySolve("xss", solvedAt)).isEqualTo(Classification.SUSPECT);
    }

    @Test
    @DisplayName("Classification consumes the window")
    void windowIsConsumed() {
        correlator.recordInteraction("xss", true);
        correlator.classifySolve("xss", clock.instant());

        assertThat(correlator.recentInteractions("xss")).isEmpty();
    }

    @Test
    @DisplayName("Unknown scenarios are silently dropped")
    void unknownScenarioDropped() {
        assertThatCode(() -> correlator.recordInteraction("csrf", true)).doesNotThrowAnyException();
        assertThat(correlator.recentInteractions("csrf")).isEmpty();
    }

    @Test
    @DisplayName("Window settings must be positive")
    void invalidSettings() {
        assertThatThrownBy(() -> new AntiCheatCorrelator(registry, clock, 0, Duration.ofMinutes(1)))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> new AntiCheatCorrelator(registry, clock, 5, Duration.ZERO))
                .isInstanceOf(ConfigException.class);
    }
}
