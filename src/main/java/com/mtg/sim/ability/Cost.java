package com.mtg.sim.ability;

import com.mtg.sim.card.ManaCost;

/**
 * Activation cost of an ability: mana, tapping the source, life, or any mix.
 */
public record Cost(ManaCost mana, boolean tap, int life) {
    public static final Cost NONE = new Cost(ManaCost.ZERO, false, 0);
    public static final Cost TAP = new Cost(ManaCost.ZERO, true, 0);

    public Cost {
        if (mana == null) {
            mana = ManaCost.ZERO;
        }
        if (life < 0) {
            throw new IllegalArgumentException("Life cost cannot be negative: " + life);
        }
    }

    public static Cost mana(ManaCost mana) {
        return new Cost(mana, false, 0);
    }

    public static Cost manaAndTap(ManaCost mana) {
        return new Cost(mana, true, 0);
    }

    public boolean isFree() {
        return mana.isZero() && !tap && life == 0;
    }
}
