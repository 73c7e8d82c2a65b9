package com.mtg.sim.ability;

import com.mtg.sim.card.ManaType;

import java.util.List;

/**
 * A single typed operation produced by the ability parser.
 * Resolution dispatches on {@link #type()} and never inspects rules text.
 */
public sealed interface Effect permits Effect.DealDamage, Effect.GainLife, Effect.LoseLife, Effect.DrawCards,
        Effect.AddMana, Effect.ModifyStats, Effect.DestroyPermanent, Effect.CounterSpell,
        Effect.TapPermanent, Effect.GainProtection {

    EffectType type();

    TargetSpec target();

    default EffectDuration duration() {
        return EffectDuration.INSTANT;
    }

    record DealDamage(int amount, TargetSpec target) implements Effect {
        @Override
        public EffectType type() {
            return EffectType.DEAL_DAMAGE;
        }
    }

    record GainLife(int amount, TargetSpec target) implements Effect {
        @Override
        public EffectType type() {
            return EffectType.GAIN_LIFE;
        }
    }

    record LoseLife(int amount, TargetSpec target) implements Effect {
        @Override
        public EffectType type() {
            return EffectType.LOSE_LIFE;
        }
    }

    record DrawCards(int count, TargetSpec target) implements Effect {
        @Override
        public EffectType type() {
            return EffectType.DRAW_CARDS;
        }
    }

    /**
     * Adds mana. With several options (or ANY) the activator picks one type.
     */
    record AddMana(List<ManaType> options, int amount) implements Effect {
        public AddMana {
            if (options == null || options.isEmpty()) {
                throw new IllegalArgumentException("AddMana needs at least one mana type");
            }
            options = List.copyOf(options);
        }

        @Override
        public EffectType type() {
            return EffectType.ADD_MANA;
        }

        @Override
        public TargetSpec target() {
            return TargetSpec.CONTROLLER;
        }

        /**
         * Resolve the mana type actually added for a requested choice.
         */
        public ManaType produce(ManaType requested) {
            if (requested == null) {
                return options.get(0);
            }
            if (options.contains(requested)) {
                return requested;
            }
            if (options.contains(ManaType.ANY) && requested.isColor()) {
                return requested;
            }
            return options.get(0);
        }
    }

    record ModifyStats(int power, int toughness, TargetSpec target, EffectDuration duration) implements Effect {
        @Override
        public EffectType type() {
            return EffectType.MODIFY_STATS;
        }
    }

    record DestroyPermanent(TargetSpec target) implements Effect {
        @Override
        public EffectType type() {
            return EffectType.DESTROY_PERMANENT;
        }
    }

    record CounterSpell(TargetSpec target) implements Effect {
        public static final CounterSpell TARGET_SPELL = new CounterSpell(TargetSpec.TARGET_SPELL);

        @Override
        public EffectType type() {
            return EffectType.COUNTER_SPELL;
        }
    }

    record TapPermanent(TargetSpec target, boolean untap) implements Effect {
        @Override
        public EffectType type() {
            return EffectType.TAP_PERMANENT;
        }
    }

    /**
     * Static protection; read directly off the permanent, never resolved.
     */
    record GainProtection(ProtectionQuality quality) implements Effect {
        @Override
        public EffectType type() {
            return EffectType.GAIN_PROTECTION;
        }

        @Override
        public TargetSpec target() {
            return TargetSpec.SOURCE;
        }

        @Override
        public EffectDuration duration() {
            return EffectDuration.PERMANENT;
        }
    }
}
