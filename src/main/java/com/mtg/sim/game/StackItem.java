package com.mtg.sim.game;

import com.mtg.sim.ability.Ability;
import com.mtg.sim.ability.Effect;
import com.mtg.sim.ability.Target;
import com.mtg.sim.card.Card;
import com.mtg.sim.card.ColorFlags;

import java.util.List;

/**
 * A spell or ability waiting on the stack.
 */
public abstract class StackItem {
    private final long id;
    private final int controllerSeat;
    private final List<Target> targets;
    private boolean countered;

    protected StackItem(long id, int controllerSeat, List<Target> targets) {
        this.id = id;
        this.controllerSeat = controllerSeat;
        this.targets = List.copyOf(targets);
    }

    public long getId() {
        return id;
    }

    public int getControllerSeat() {
        return controllerSeat;
    }

    public List<Target> getTargets() {
        return targets;
    }

    /**
     * Target bound to the n-th targeted effect. Effects beyond the chosen targets
     * share the last one ("deal 2 damage to target creature and tap it").
     */
    public Target getTargetForEffect(int targetedIndex) {
        if (targets.isEmpty()) {
            return null;
        }
        return targets.get(Math.min(targetedIndex, targets.size() - 1));
    }

    public boolean isCountered() {
        return countered;
    }

    /**
     * Set only by a resolving counter effect.
     */
    void markCountered() {
        this.countered = true;
    }

    public abstract String getName();

    public abstract List<Effect> getEffects();

    public abstract ColorFlags getColors();

    public abstract boolean isArtifactSource();

    /**
     * A cast spell. The card is off every zone until the spell resolves or is countered.
     */
    public static final class Spell extends StackItem {
        private final Card card;
        private final List<Effect> effects;

        public Spell(long id, int controllerSeat, Card card, List<Effect> effects, List<Target> targets) {
            super(id, controllerSeat, targets);
            this.card = card;
            this.effects = List.copyOf(effects);
        }

        public Card getCard() {
            return card;
        }

        @Override
        public String getName() {
            return card.getName();
        }

        @Override
        public List<Effect> getEffects() {
            return effects;
        }

        @Override
        public ColorFlags getColors() {
            return card.getColors();
        }

        @Override
        public boolean isArtifactSource() {
            return card.isArtifact();
        }

        @Override
        public String toString() {
            return "Spell[" + card.getName() + " #" + getId() + (isCountered() ? ", countered" : "") + "]";
        }
    }

    /**
     * An activated or triggered ability of a permanent.
     */
    public static final class AbilityItem extends StackItem {
        private final Ability ability;
        private final long sourceId;
        private final Card sourceCard;
        private final boolean requiresSource;

        /**
         * @param requiresSource whether the ability fizzles once its source leaves the battlefield
         */
        public AbilityItem(long id, int controllerSeat, Ability ability, long sourceId, Card sourceCard,
                           List<Target> targets, boolean requiresSource) {
            super(id, controllerSeat, targets);
            this.ability = ability;
            this.sourceId = sourceId;
            this.sourceCard = sourceCard;
            this.requiresSource = requiresSource;
        }

        public Ability getAbility() {
            return ability;
        }

        public long getSourceId() {
            return sourceId;
        }

        public Card getSourceCard() {
            return sourceCard;
        }

        public boolean requiresSource() {
            return requiresSource;
        }

        @Override
        public String getName() {
            return ability.name();
        }

        @Override
        public List<Effect> getEffects() {
            return ability.effects();
        }

        @Override
        public ColorFlags getColors() {
            return sourceCard.getColors();
        }

        @Override
        public boolean isArtifactSource() {
            return sourceCard.isArtifact();
        }

        @Override
        public String toString() {
            return "Ability[" + ability.name() + " #" + getId() + (isCountered() ? ", countered" : "") + "]";
        }
    }
}
