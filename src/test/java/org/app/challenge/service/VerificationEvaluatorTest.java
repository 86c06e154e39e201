package org.app.challenge.service;

import org.app.challenge.event.ChallengeEvent;
import org.app.challenge.event.ChallengeEventType;
import org.app.challenge.event.Subscription;
import org.app.challenge.exception.ScenarioNotFoundException;
import org.app.challenge.model.Classification;
import org.app.challenge.model.DeploymentProfile;
import org.app.challenge.model.Outcome;
import org.app.challenge.model.SolveRecord;
import org.app.challenge.model.SolveState;
import org.app.challenge.support.EngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.app.challenge.support.EngineFixture.disabledIn;
import static org.app.challenge.support.EngineFixture.scenario;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("VerificationEvaluator")
class VerificationEvaluatorTest {

    private EngineFixture engine;
    private Subscription events;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture(List.of(
                scenario("sqlInjection", "A03:2021", "h1", "h2"),
                disabledIn(scenario("xss", "A03:2021", "h1"), "safety-mode"),
                scenario("idor", "A01:2021")),
                DeploymentProfile.of("safety-mode"), 128, r -> { });
        events = engine.broadcaster.subscribe();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private List<ChallengeEvent> drainEvents() throws InterruptedException {
        List<ChallengeEvent> out = new ArrayList<>();
        Optional<ChallengeEvent> next;
        while ((next = events.poll(Duration.ofMillis(50))).isPresent()) {
            out.add(next.get());
        }
        return out;
    }

    @Nested
    @DisplayName("Solve transition")
    class SolveTransition {

        @Test
        @DisplayName("Disabled scenario reports INACTIVE, enabled one solves once")
        void inactiveThenFirstSolveThenAlreadySolved() throws Exception {
            assertThat(engine.evaluator.attempt("xss", () -> true)).isEqualTo(Outcome.INACTIVE);
            assertThat(engine.evaluator.attempt("sqlInjection", () -> true)).isEqualTo(Outcome.FIRST_SOLVE);
            assertThat(engine.evaluator.attempt("sqlInjection", () -> true)).isEqualTo(Outcome.ALREADY_SOLVED);

            List<ChallengeEvent> published = drainEvents();
            assertThat(published).filteredOn(e -> e.getType() == ChallengeEventType.SOLVED)
                    .extracting(ChallengeEvent::getScenarioKey)
                    .containsExactly("sqlInjection");
        }

        @Test
        @DisplayName("False predicate leaves the scenario unsolved but counts the attempt")
        void notSolved() {
            assertThat(engine.evaluator.attempt("idor", () -> false)).isEqualTo(Outcome.NOT_SOLVED);

            SolveState state = engine.store.snapshot("idor");
            assertThat(state.isSolved()).isFalse();
            assertThat(state.getAttemptCount()).isEqualTo(1);
            assertThat(state.getClassification()).isEqualTo(Classification.UNCLASSIFIED);
        }

        @Test
        @DisplayName("Inactive scenario is never mutated and its predicate never runs")
        void inactiveDoesNotMutate() {
            AtomicInteger evaluations = new AtomicInteger();

            assertThat(engine.evaluator.attempt("xss", () -> evaluations.incrementAndGet() > 0))
                    .isEqualTo(Outcome.INACTIVE);
            assertThat(engine.evaluator.attempt("xss", () -> false)).isEqualTo(Outcome.INACTIVE);

            SolveState state = engine.store.snapshot("xss");
            assertThat(evaluations).hasValue(0);
            assertThat(state.isSolved()).isFalse();
            assertThat(state.getAttemptCount()).isZero();
            assertThat(engine.recorded).isEmpty();
        }

        @Test
        @DisplayName("Repeated attempts never move solvedAt")
        void solvedAtIsStable() {
            engine.evaluator.attempt("idor", () -> true);
            Instant first = engine.store.snapshot("idor").getSolvedAt().orElseThrow();

            engine.clock.advance(Duration.ofMinutes(10));
            engine.evaluator.attempt("idor", () -> true);
            engine.evaluator.attempt("idor", () -> false);

            SolveState state = engine.store.snapshot("idor");
            assertThat(state.getSolvedAt()).contains(first);
            assertThat(state.getAttemptCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Profile swap takes effect on the next attempt")
        void profileSwap() {
            assertThat(engine.evaluator.attempt("xss", () -> true)).isEqualTo(Outcome.INACTIVE);

            engine.profileSource.swap(DeploymentProfile.empty());

            assertThat(engine.evaluator.attempt("xss", () -> true)).isEqualTo(Outcome.FIRST_SOLVE);
        }

        @Test
        @DisplayName("Unknown scenario is reported to the caller")
        void unknownScenario() {
            assertThatThrownBy(() -> engine.evaluator.attempt("csrf", () -> true))
                    .isInstanceOf(ScenarioNotFoundException.class);
        }

        @Test
        @DisplayName("Throwing predicate counts as not solved")
        void throwingPredicate() {
            Outcome outcome = engine.evaluator.attempt("idor", () -> {
                throw new IllegalStateException("boom");
            });

            assertThat(outcome).isEqualTo(Outcome.NOT_SOLVED);
            assertThat(engine.store.isSolved("idor")).isFalse();
            assertThat(engine.store.attemptCount("idor")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("50 concurrent solvers produce exactly one FIRST_SOLVE and one event")
        void singleWinner() throws Exception {
            int callers = 50;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            CountDownLatch ready = new CountDownLatch(callers);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<Outcome>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < callers; i++) {
                    Callable<Outcome> task = () -> {
                        ready.countDown();
                        go.await();
                        return engine.evaluator.attempt("idor", () -> true);
                    };
                    futures.add(pool.submit(task));
                }
                assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
                go.countDown();

                List<Outcome> outcomes = new ArrayList<>();
                for (Future<Outcome> f : futures) {
                    outcomes.add(f.get(10, TimeUnit.SECONDS));
                }

                assertThat(outcomes).filteredOn(o -> o == Outcome.FIRST_SOLVE).hasSize(1);
                assertThat(outcomes).filteredOn(o -> o == Outcome.ALREADY_SOLVED).hasSize(callers - 1);
                assertThat(engine.store.attemptCount("idor")).isEqualTo(callers);
                assertThat(engine.recorded).hasSize(1);
                assertThat(drainEvents()).filteredOn(e -> e.getType() == ChallengeEventType.SOLVED).hasSize(1);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Side effects of a first solve")
    class FirstSolveEffects {

        @Test
        @DisplayName("Solve after intended-path interaction is legitimate")
        void legitimateSolve() throws Exception {
            engine.correlator.recordInteraction("sqlInjection", true);
            engine.clock.advance(Duration.ofSeconds(30));

            engine.evaluator.attempt("sqlInjection", () -> true);

            assertThat(engine.store.snapshot("sqlInjection").getClassification()).isEqualTo(Classification.LEGITIMATE);
            ChallengeEvent solved = drainEvents().stream()
                    .filter(e -> e.getType() == ChallengeEventType.SOLVED).findFirst().orElseThrow();
            assertThat(solved.getClassification()).isEqualTo(Classification.LEGITIMATE);
            assertThat(solved.getTimestamp()).isEqualTo(engine.clock.instant());
        }

        @Test
        @DisplayName("Only direct-path interactions make the solve suspect")
        void suspectSolve() {
            engine.profileSource.swap(DeploymentProfile.empty());
            for (int i = 0; i < 3; i++) {
                engine.correlator.recordInteraction("xss", false);
            }

            assertThat(engine.evaluator.attempt("xss", () -> true)).isEqualTo(Outcome.FIRST_SOLVE);
            assertThat(engine.store.snapshot("xss").getClassification()).isEqualTo(Classification.SUSPECT);
            assertThat(engine.store.isSolved("xss")).isTrue();
        }

        @Test
        @DisplayName("Solve hands a record to the sink and unlocks every hint")
        void recordsAndRevealsHints() {
            engine.evaluator.attempt("sqlInjection", () -> true);

            assertThat(engine.recorded).singleElement().satisfies(r -> {
                assertThat(r.scenarioKey()).isEqualTo("sqlInjection");
                assertThat(r.classification()).isEqualTo(Classification.SUSPECT);
                assertThat(r.attemptCount()).isEqualTo(1);
            });
            assertThat(engine.hints.unlockedHints("sqlInjection")).containsExactly("h1", "h2");
            assertThat(engine.hints.hintState("sqlInjection").getUnlockedCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Failing sink does not block the solve and is called once")
        void failingSink() {
            SolveRecordSink sink = mock(SolveRecordSink.class);
            doThrow(new IllegalStateException("database down")).when(sink).record(any());
            EngineFixture failing = new EngineFixture(List.of(scenario("idor", null)), DeploymentProfile.empty(),
                    8, sink);
            try {
                assertThat(failing.evaluator.attempt("idor", () -> true)).isEqualTo(Outcome.FIRST_SOLVE);
                assertThat(failing.evaluator.attempt("idor", () -> true)).isEqualTo(Outcome.ALREADY_SOLVED);
                assertThat(failing.store.isSolved("idor")).isTrue();

                ArgumentCaptor<SolveRecord> captor = ArgumentCaptor.forClass(SolveRecord.class);
                verify(sink, times(1)).record(captor.capture());
                assertThat(captor.getValue().scenarioKey()).isEqualTo("idor");
                assertThat(captor.getValue().solvedAt()).isEqualTo(EngineFixture.START);
            } finally {
                failing.close();
            }
        }

        @Test
        @DisplayName("Attempts and solves are counted in the meter registry")
        void metrics() {
            engine.evaluator.attempt("idor", () -> false);
            engine.evaluator.attempt("idor", () -> true);

            assertThat(engine.meterRegistry.counter("challenge.attempts", "scenario", "idor").count()).isEqualTo(2.0);
            assertThat(engine.meterRegistry.counter("challenge.solves", "classification", "SUSPECT").count())
                    .isEqualTo(1.0);
        }
    }
}
