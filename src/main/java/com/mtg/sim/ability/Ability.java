package com.mtg.sim.ability;

import java.util.List;

/**
 * Structured ability of a card, as produced by an {@link AbilityParser}.
 */
public sealed interface Ability permits Ability.Activated, Ability.Triggered, Ability.Static, Ability.Mana {

    enum Kind {
        ACTIVATED,
        TRIGGERED,
        STATIC,
        MANA
    }

    String name();

    Cost cost();

    TimingRestriction timing();

    List<Effect> effects();

    Kind kind();

    /**
     * True if any effect needs a chosen target.
     */
    default boolean isTargeted() {
        for (Effect effect : effects()) {
            if (effect.target().isTargeted()) {
                return true;
            }
        }
        return false;
    }

    record Activated(String name, Cost cost, TimingRestriction timing, List<Effect> effects) implements Ability {
        public Activated {
            effects = List.copyOf(effects);
        }

        @Override
        public Kind kind() {
            return Kind.ACTIVATED;
        }
    }

    record Triggered(String name, TriggerCondition trigger, List<Effect> effects) implements Ability {
        public Triggered {
            effects = List.copyOf(effects);
        }

        @Override
        public Cost cost() {
            return Cost.NONE;
        }

        @Override
        public TimingRestriction timing() {
            return TimingRestriction.ANY_TIME;
        }

        @Override
        public Kind kind() {
            return Kind.TRIGGERED;
        }
    }

    record Static(String name, List<Effect> effects) implements Ability {
        public Static {
            effects = List.copyOf(effects);
        }

        @Override
        public Cost cost() {
            return Cost.NONE;
        }

        @Override
        public TimingRestriction timing() {
            return TimingRestriction.ANY_TIME;
        }

        @Override
        public Kind kind() {
            return Kind.STATIC;
        }
    }

    /**
     * Mana ability. Resolves immediately on activation and ignores summoning sickness.
     */
    record Mana(String name, Cost cost, Effect.AddMana production) implements Ability {
        @Override
        public TimingRestriction timing() {
            return TimingRestriction.ANY_TIME;
        }

        @Override
        public List<Effect> effects() {
            return List.of(production);
        }

        @Override
        public Kind kind() {
            return Kind.MANA;
        }
    }
}
