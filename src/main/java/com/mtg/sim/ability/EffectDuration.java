package com.mtg.sim.ability;

/**
 * How long an effect lasts once applied.
 */
public enum EffectDuration {
    INSTANT,
    UNTIL_END_OF_TURN,
    PERMANENT
}
