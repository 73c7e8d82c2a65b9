package com.mtg.sim.ability;

/**
 * Game events that put triggered abilities on the stack.
 */
public enum TriggerCondition {
    ENTERS_THE_BATTLEFIELD,
    DIES,
    BEGINNING_OF_UPKEEP,
    END_STEP
}
