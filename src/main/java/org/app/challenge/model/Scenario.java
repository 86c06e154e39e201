package org.app.challenge.model;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static definition of a trainable scenario:
 * - key: unique identifier used by request handlers
 * - difficulty: 1 (trivial) .. 6 (expert)
 * - hints: ordered, revealed front to back
 * - disabledIn: profile names under which the scenario is inactive
 * - owasp: optional OWASP Top 10 category for progress reporting
 */
public class Scenario {
    public static final int MIN_DIFFICULTY = 1;
    public static final int MAX_DIFFICULTY = 6;

    private final String key;
    private final String name;
    private final String category;
    private final OwaspCategory owasp;
    private final int difficulty;
    private final String description;
    private final List<String> hints;
    private final Set<String> disabledIn;

    public Scenario(String key, String name, String category, OwaspCategory owasp, int difficulty,
                    String description, List<String> hints, Set<String> disabledIn) {
        this.key = key;
        this.name = name;
        this.category = category;
        this.owasp = owasp;
        this.difficulty = difficulty;
        this.description = description;
        this.hints = List.copyOf(hints);
        this.disabledIn = Set.copyOf(disabledIn);
    }

    public String getKey() { return key; }
    public String getName() { return name; }
    public String getCategory() { return category; }
    public Optional<OwaspCategory> getOwasp() { return Optional.ofNullable(owasp); }
    public int getDifficulty() { return difficulty; }
    public String getDescription() { return description; }
    public List<String> getHints() { return hints; }
    public Set<String> getDisabledIn() { return disabledIn; }

    @Override
    public String toString() {
        return "Scenario{" + key + ", difficulty=" + difficulty + "}";
    }
}
