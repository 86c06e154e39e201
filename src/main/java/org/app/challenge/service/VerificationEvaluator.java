package org.app.challenge.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.app.challenge.event.ChallengeEvent;
import org.app.challenge.event.EventBroadcaster;
import org.app.challenge.exception.ScenarioNotFoundException;
import org.app.challenge.model.Classification;
import org.app.challenge.model.Outcome;
import org.app.challenge.model.Scenario;
import org.app.challenge.model.SolveRecord;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Owns the solve transition. Detecting the exploit is the caller's job: it hands in a predicate
 * that reports whether the exploit condition held, and this class decides what that means for the
 * scenario's state.
 * <p>
 * Under any number of concurrent callers exactly one observes {@link Outcome#FIRST_SOLVE} per
 * scenario, and only that caller classifies, broadcasts and records the solve.
 */
@Slf4j
@RequiredArgsConstructor
public class VerificationEvaluator {

    private final ScenarioRegistry registry;
    private final EnablementResolver resolver;
    private final ActiveProfileSource profileSource;
    private final SolveStateStore store;
    private final AntiCheatCorrelator correlator;
    private final HintProgressionTracker hintTracker;
    private final EventBroadcaster broadcaster;
    private final SolveRecordSink solveRecordSink;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    /**
     * @throws ScenarioNotFoundException if the key is not registered
     */
    public Outcome attempt(String scenarioKey, BooleanSupplier predicate) {
        Objects.requireNonNull(predicate, "predicate");
        Scenario scenario = registry.lookup(scenarioKey);
        if (!resolver.isActive(scenario, profileSource.currentProfile())) {
            log.debug("Attempt on inactive scenario '{}'", scenarioKey);
            return Outcome.INACTIVE;
        }

        store.recordAttempt(scenarioKey);
        meterRegistry.counter("challenge.attempts", "scenario", scenarioKey).increment();
        if (!holds(scenarioKey, predicate)) {
            hintTracker.onAttempt(scenario);
            return Outcome.NOT_SOLVED;
        }

        Instant solvedAt = clock.instant();
        if (!store.markSolved(scenarioKey, solvedAt)) {
            return Outcome.ALREADY_SOLVED;
        }

        Classification classification = correlator.classifySolve(scenarioKey, solvedAt);
        store.classify(scenarioKey, classification);
        hintTracker.onSolved(scenarioKey);
        log.info("Scenario '{}' solved at {} ({})", scenarioKey, solvedAt, classification);
        meterRegistry.counter("challenge.solves", "classification", classification.name()).increment();

        broadcaster.publish(ChallengeEvent.solved(scenarioKey, solvedAt, classification));
        persist(scenario, solvedAt, classification);
        return Outcome.FIRST_SOLVE;
    }

    private boolean holds(String scenarioKey, BooleanSupplier predicate) {
        try {
            return predicate.getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("Predicate for '{}' threw, treating attempt as not solved: {}", scenarioKey, e.toString());
            return false;
        }
    }

    private void persist(Scenario scenario, Instant solvedAt, Classification classification) {
        SolveRecord solveRecord = new SolveRecord(scenario.getKey(), scenario.getName(), scenario.getDifficulty(),
                solvedAt, classification, store.attemptCount(scenario.getKey()));
        try {
            solveRecordSink.record(solveRecord);
        } catch (RuntimeException e) {
            log.warn("Could not persist solve of '{}': {}", scenario.getKey(), e.getMessage(), e);
        }
    }
}
