package org.app.challenge.service;

import lombok.extern.slf4j.Slf4j;
import org.app.challenge.exception.ConfigException;
import org.app.challenge.exception.ScenarioNotFoundException;
import org.app.challenge.model.DeploymentProfile;
import org.app.challenge.model.OwaspCategory;
import org.app.challenge.model.Scenario;
import org.app.challenge.model.ScenarioDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Catalog of all trainable scenarios, in definition order. Frozen once loaded, so lookups need no
 * synchronization.
 */
@Slf4j
public final class ScenarioRegistry {

    private final Map<String, Scenario> scenarios;

    private ScenarioRegistry(Map<String, Scenario> scenarios) {
        this.scenarios = Collections.unmodifiableMap(scenarios);
    }

    /**
     * Validates every definition and builds the registry. Any malformed or duplicate entry aborts
     * the whole load.
     *
     * @throws ConfigException on a missing required field, a difficulty outside 1..6, an unknown
     *                         OWASP code, a blank profile name or a duplicate key
     */
    public static ScenarioRegistry load(Collection<ScenarioDefinition> definitions) {
        if (definitions == null) throw new ConfigException("Scenario definitions must not be null");
        Map<String, Scenario> byKey = new LinkedHashMap<>();
        int index = 0;
        for (ScenarioDefinition def : definitions) {
            Scenario s = toScenario(def, index++);
            if (byKey.putIfAbsent(s.getKey(), s) != null) {
                throw new ConfigException("Duplicate scenario key: " + s.getKey());
            }
        }
        log.info("Loaded {} scenarios", byKey.size());
        return new ScenarioRegistry(byKey);
    }

    private static Scenario toScenario(ScenarioDefinition def, int index) {
        if (def == null) throw new ConfigException("Scenario definition #" + index + " is null");
        String key = required(def.getKey(), "key", index);
        String name = required(def.getName(), "name", key);
        String category = required(def.getCategory(), "category", key);
        Integer difficulty = def.getDifficulty();
        if (difficulty == null) {
            throw new ConfigException("Scenario '" + key + "' is missing required field 'difficulty'");
        }
        if (difficulty < Scenario.MIN_DIFFICULTY || difficulty > Scenario.MAX_DIFFICULTY) {
            throw new ConfigException("Scenario '" + key + "' has difficulty " + difficulty
                    + ", expected " + Scenario.MIN_DIFFICULTY + ".." + Scenario.MAX_DIFFICULTY);
        }
        OwaspCategory owasp = def.getOwasp() == null || def.getOwasp().isBlank()
                ? null
                : OwaspCategory.fromCode(def.getOwasp());

        List<String> hints = new ArrayList<>();
        if (def.getHints() != null) {
            for (String h : def.getHints()) {
                if (h == null || h.isBlank()) {
                    throw new ConfigException("Scenario '" + key + "' has a blank hint");
                }
                hints.add(h);
            }
        }
        Set<String> disabledIn = new LinkedHashSet<>();
        if (def.getDisabledIn() != null) {
            for (String p : def.getDisabledIn()) {
                disabledIn.add(DeploymentProfile.normalize(p));
            }
        }
        String description = def.getDescription() == null ? "" : def.getDescription();
        return new Scenario(key.trim(), name, category, owasp, difficulty, description, hints, disabledIn);
    }

    private static String required(String value, String field, Object where) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Scenario '" + where + "' is missing required field '" + field + "'");
        }
        return value;
    }

    /**
     * @throws ScenarioNotFoundException if no scenario has this key
     */
    public Scenario lookup(String key) {
        Scenario s = key == null ? null : scenarios.get(key);
        if (s == null) throw new ScenarioNotFoundException(key);
        return s;
    }

    public boolean contains(String key) {
        return key != null && scenarios.containsKey(key);
    }

    public Collection<Scenario> all() {
        return scenarios.values();
    }

    public int size() {
        return scenarios.size();
    }
}
