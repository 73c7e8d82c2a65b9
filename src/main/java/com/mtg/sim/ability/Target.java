package com.mtg.sim.ability;

/**
 * A chosen target. Targets hold ids only and are looked up again on resolution,
 * so a target that has left play is detected instead of dangling.
 */
public sealed interface Target permits Target.PlayerTarget, Target.PermanentTarget, Target.SpellTarget {

    static Target player(int seat) {
        return new PlayerTarget(seat);
    }

    static Target permanent(long permanentId) {
        return new PermanentTarget(permanentId);
    }

    static Target spell(long stackItemId) {
        return new SpellTarget(stackItemId);
    }

    record PlayerTarget(int seat) implements Target {
    }

    record PermanentTarget(long permanentId) implements Target {
    }

    record SpellTarget(long stackItemId) implements Target {
    }
}
