package com.mtg.sim.game;

/**
 * What happens after a player passes priority.
 */
public enum PassOutcome {
    /** Priority moved to the next player. */
    PRIORITY_PASSED,
    /** Every player passed in succession with a non-empty stack. */
    RESOLVE_TOP,
    /** Every player passed in succession with an empty stack. */
    STEP_ENDS
}
