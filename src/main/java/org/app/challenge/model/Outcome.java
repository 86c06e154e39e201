package org.app.challenge.model;

/**
 * Result of a verification attempt. None of these are errors; callers are expected to branch on them.
 */
public enum Outcome {
    /** Scenario is disabled under the active profile; nothing was recorded. */
    INACTIVE,
    /** Predicate did not hold. */
    NOT_SOLVED,
    /** Predicate held but another call had already solved the scenario. */
    ALREADY_SOLVED,
    /** This call performed the solve transition. */
    FIRST_SOLVE
}
