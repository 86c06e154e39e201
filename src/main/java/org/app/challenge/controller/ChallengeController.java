package org.app.challenge.controller;

import lombok.extern.slf4j.Slf4j;
import org.app.challenge.event.ChallengeEvent;
import org.app.challenge.event.EventBroadcaster;
import org.app.challenge.event.Subscription;
import org.app.challenge.model.ProgressReport;
import org.app.challenge.model.Scenario;
import org.app.challenge.model.SolveState;
import org.app.challenge.service.ActiveProfileSource;
import org.app.challenge.service.EnablementResolver;
import org.app.challenge.service.HintProgressionTracker;
import org.app.challenge.service.ProgressReportService;
import org.app.challenge.service.ScenarioRegistry;
import org.app.challenge.service.SolveStateStore;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only admin endpoints:
 * GET /challenges                         all scenarios with solve state
 * GET /challenges/{key}                   solve and hint state of one scenario
 * GET /challenges/{key}/hints             currently unlocked hints
 * GET /challenges/report?format=markdown  OWASP progress report (markdown | json)
 * GET /challenges/events                  server-sent event stream of solves and hint unlocks
 */
@Slf4j
@RestController
@RequestMapping("/challenges")
public class ChallengeController {

    private final ScenarioRegistry registry;
    private final EnablementResolver resolver;
    private final ActiveProfileSource profileSource;
    private final SolveStateStore store;
    private final HintProgressionTracker hints;
    private final ProgressReportService reports;
    private final EventBroadcaster broadcaster;

    public ChallengeController(ScenarioRegistry registry, EnablementResolver resolver,
                               ActiveProfileSource profileSource, SolveStateStore store,
                               HintProgressionTracker hints, ProgressReportService reports,
                               EventBroadcaster broadcaster) {
        this.registry = registry;
        this.resolver = resolver;
        this.profileSource = profileSource;
        this.store = store;
        this.hints = hints;
        this.reports = reports;
        this.broadcaster = broadcaster;
    }

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> list() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Scenario s : registry.all()) {
            out.add(describe(s));
        }
        return ResponseEntity.ok(out);
    }

    @GetMapping("/{key}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String key) {
        Scenario s = registry.lookup(key);
        Map<String, Object> body = describe(s);
        body.put("hints", hints.hintState(key));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{key}/hints")
    public ResponseEntity<Map<String, Object>> unlockedHints(@PathVariable String key) {
        return ResponseEntity.ok(Map.of("key", key, "hints", hints.unlockedHints(key)));
    }

    @GetMapping("/report")
    public ResponseEntity<String> report(@RequestParam(name = "format", required = false) String format) {
        ProgressReport report = reports.generate();
        if ("json".equalsIgnoreCase(format)) {
            return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(reports.renderJson(report));
        }
        return ResponseEntity.ok().contentType(MediaType.valueOf("text/markdown")).body(reports.renderMarkdown(report));
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        SseEmitter emitter = new SseEmitter(0L);
        Subscription sub = broadcaster.subscribe(event -> send(emitter, event));
        sub.onClose(emitter::complete);
        emitter.onCompletion(sub::close);
        emitter.onTimeout(sub::close);
        emitter.onError(e -> sub.close());
        log.info("Event stream opened ({} subscribers)", broadcaster.subscriberCount());
        return emitter;
    }

    private void send(SseEmitter emitter, ChallengeEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.getType().name()).data(event, MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            // client went away; surfacing it closes the subscription
            throw new UncheckedIOException(e);
        }
    }

    private Map<String, Object> describe(Scenario s) {
        SolveState state = store.snapshot(s.getKey());
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("key", s.getKey());
        m.put("name", s.getName());
        m.put("category", s.getCategory());
        m.put("owasp", s.getOwasp().map(o -> o.getCode()).orElse(null));
        m.put("difficulty", s.getDifficulty());
        m.put("active", resolver.isActive(s, profileSource.currentProfile()));
        m.put("solved", state.isSolved());
        m.put("solvedAt", state.getSolvedAt().orElse(null));
        m.put("classification", state.getClassification());
        m.put("attemptCount", state.getAttemptCount());
        return m;
    }
}
