package com.mtg.sim.game;

/**
 * Steps of a turn, in order.
 */
public enum Step {
    UNTAP,
    UPKEEP,
    DRAW,
    MAIN1,
    BEGIN_COMBAT,
    DECLARE_ATTACKERS,
    DECLARE_BLOCKERS,
    COMBAT_DAMAGE,
    END_COMBAT,
    MAIN2,
    END,
    CLEANUP;

    /**
     * Check if this is a main phase (when sorceries can be cast).
     */
    public boolean isMainPhase() {
        return this == MAIN1 || this == MAIN2;
    }

    public boolean isCombat() {
        return this == BEGIN_COMBAT || this == DECLARE_ATTACKERS || this == DECLARE_BLOCKERS
                || this == COMBAT_DAMAGE || this == END_COMBAT;
    }

    /**
     * Whether players receive priority during this step.
     */
    public boolean hasPriority() {
        return this != UNTAP && this != CLEANUP;
    }
}
