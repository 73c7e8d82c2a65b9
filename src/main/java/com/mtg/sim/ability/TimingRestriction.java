package com.mtg.sim.ability;

/**
 * When an activated ability may be activated.
 */
public enum TimingRestriction {
    ANY_TIME,
    INSTANT_SPEED,
    SORCERY_SPEED,
    ONLY_DURING_COMBAT,
    ONLY_YOUR_TURN
}
