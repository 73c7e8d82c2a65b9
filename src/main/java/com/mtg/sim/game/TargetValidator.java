package com.mtg.sim.game;

import com.mtg.sim.ability.Effect;
import com.mtg.sim.ability.Target;
import com.mtg.sim.ability.TargetSpec;
import com.mtg.sim.card.CardType;
import com.mtg.sim.card.ColorFlags;
import com.mtg.sim.card.Keyword;
import com.mtg.sim.game.zones.Permanent;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a chosen target is legal for an effect right now.
 */
public class TargetValidator {
    private final Game game;

    public TargetValidator(Game game) {
        this.game = game;
    }

    /**
     * Check target legality: existence, kind, shroud, hexproof and protection.
     */
    public boolean isLegal(Target target, TargetSpec spec, int controllerSeat,
                           ColorFlags sourceColors, boolean sourceIsArtifact) {
        if (target == null || !spec.accepts(target)) {
            return false;
        }
        if (target instanceof Target.PlayerTarget playerTarget) {
            int seat = playerTarget.seat();
            return seat >= 0 && seat < game.getPlayers().size() && !game.getPlayer(seat).hasLost();
        }
        if (target instanceof Target.SpellTarget spellTarget) {
            Optional<StackItem> item = game.getStack().find(spellTarget.stackItemId());
            return item.isPresent() && item.get() instanceof StackItem.Spell;
        }

        Optional<Permanent> found = game.findPermanent(((Target.PermanentTarget) target).permanentId());
        if (found.isEmpty()) {
            return false;
        }
        Permanent permanent = found.get();
        if (spec == TargetSpec.TARGET_CREATURE && !permanent.isCreature()) {
            return false;
        }
        if (spec == TargetSpec.ANY_TARGET && !permanent.isCreature()
                && !permanent.getCard().hasType(CardType.PLANESWALKER)) {
            return false;
        }
        if (permanent.hasKeyword(Keyword.SHROUD)) {
            return false;
        }
        if (permanent.hasKeyword(Keyword.HEXPROOF) && permanent.getControllerSeat() != controllerSeat) {
            return false;
        }
        return !permanent.isProtectedFrom(sourceColors, sourceIsArtifact);
    }

    /**
     * Validate the targets chosen for a list of effects at cast or activation time.
     * @throws TargetInvalidException if a targeted effect has no target or an illegal one
     */
    public void validate(List<Effect> effects, List<Target> targets, int controllerSeat,
                         ColorFlags sourceColors, boolean sourceIsArtifact) throws TargetInvalidException {
        int targetedIndex = 0;
        for (Effect effect : effects) {
            if (!effect.target().isTargeted()) {
                continue;
            }
            if (targets.isEmpty()) {
                throw new TargetInvalidException("Missing target for " + effect.type());
            }
            Target target = targets.get(Math.min(targetedIndex, targets.size() - 1));
            if (!isLegal(target, effect.target(), controllerSeat, sourceColors, sourceIsArtifact)) {
                throw new TargetInvalidException("Illegal target " + target + " for " + effect.type());
            }
            targetedIndex++;
        }
    }
}
