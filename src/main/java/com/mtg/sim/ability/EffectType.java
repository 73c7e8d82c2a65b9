package com.mtg.sim.ability;

/**
 * Discriminator for {@link Effect} variants, used for exhaustive dispatch.
 */
public enum EffectType {
    DEAL_DAMAGE,
    GAIN_LIFE,
    LOSE_LIFE,
    DRAW_CARDS,
    ADD_MANA,
    MODIFY_STATS,
    DESTROY_PERMANENT,
    COUNTER_SPELL,
    TAP_PERMANENT,
    GAIN_PROTECTION
}
