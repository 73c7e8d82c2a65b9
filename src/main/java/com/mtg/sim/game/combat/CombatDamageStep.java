package com.mtg.sim.game.combat;

/**
 * States of combat damage resolution, in order.
 */
public enum CombatDamageStep {
    FIRST_STRIKE_DAMAGE,
    CLEANUP_1,
    REGULAR_DAMAGE,
    CLEANUP_2,
    DONE;

    public CombatDamageStep next() {
        return switch (this) {
            case FIRST_STRIKE_DAMAGE -> CLEANUP_1;
            case CLEANUP_1 -> REGULAR_DAMAGE;
            case REGULAR_DAMAGE -> CLEANUP_2;
            case CLEANUP_2, DONE -> DONE;
        };
    }
}
