package com.mtg.sim.simulation;

import com.mtg.sim.ability.Ability;
import com.mtg.sim.ability.Effect;
import com.mtg.sim.ability.EffectType;
import com.mtg.sim.ability.Target;
import com.mtg.sim.ability.TargetSpec;
import com.mtg.sim.card.Card;
import com.mtg.sim.card.ColorFlags;
import com.mtg.sim.card.Keyword;
import com.mtg.sim.card.ManaType;
import com.mtg.sim.game.Game;
import com.mtg.sim.game.GameRuleException;
import com.mtg.sim.game.Player;
import com.mtg.sim.game.PlayerStrategy;
import com.mtg.sim.game.StackItem;
import com.mtg.sim.game.Step;
import com.mtg.sim.game.TargetValidator;
import com.mtg.sim.game.combat.CombatResolver;
import com.mtg.sim.game.zones.Permanent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Greedy default player. Plays a land, casts the most expensive spell it can afford,
 * counters opposing spells when it holds a counterspell, attacks with everything and
 * blocks when the block kills the attacker or lethal damage is coming.
 */
public class SimpleStrategy implements PlayerStrategy {
    private static final Logger log = LoggerFactory.getLogger(SimpleStrategy.class);

    private static final Set<EffectType> HARMFUL = EnumSet.of(
            EffectType.DEAL_DAMAGE,
            EffectType.LOSE_LIFE,
            EffectType.DESTROY_PERMANENT,
            EffectType.COUNTER_SPELL
    );

    // ---- Lands ----

    @Override
    public Optional<Card> chooseLand(Game game, Player player) {
        List<Card> lands = new ArrayList<>();
        for (Card card : player.getHand().getCards()) {
            if (card.isLand()) {
                lands.add(card);
            }
        }
        if (lands.isEmpty()) {
            return Optional.empty();
        }

        // Prefer a land that adds a color the hand needs and the battlefield lacks
        Set<ManaType> available = new HashSet<>();
        for (Permanent source : player.getBattlefield().getAll()) {
            available.addAll(source.getProducedTypes());
        }
        Set<ManaType> missing = EnumSet.noneOf(ManaType.class);
        for (Card card : player.getHand().getCards()) {
            if (card.isLand()) {
                continue;
            }
            for (ManaType type : card.getParsedManaCost().getStrictRequirements().keySet()) {
                if (!available.contains(type) && !available.contains(ManaType.ANY)) {
                    missing.add(type);
                }
            }
        }
        for (Card land : lands) {
            for (Ability ability : game.getAbilityParser().parseAbilities(land)) {
                if (ability instanceof Ability.Mana mana) {
                    for (ManaType option : mana.production().options()) {
                        if (missing.contains(option) || (option == ManaType.ANY && !missing.isEmpty())) {
                            return Optional.of(land);
                        }
                    }
                }
            }
        }
        return Optional.of(lands.get(0));
    }

    // ---- Priority ----

    @Override
    public boolean onPriority(Game game, Player player, Step step) {
        try {
            if (tryCounter(game, player)) {
                return true;
            }
            boolean sorceryTiming = step.isMainPhase()
                    && game.getActiveSeat() == player.getSeat()
                    && game.getStack().isEmpty();
            if (sorceryTiming && castBestSpell(game, player)) {
                return true;
            }
            if (sorceryTiming && step == Step.MAIN2 && activateAbility(game, player)) {
                return true;
            }
        } catch (GameRuleException e) {
            log.debug("{} could not act: {}", player.getName(), e.getMessage());
        }
        return false;
    }

    private boolean tryCounter(Game game, Player player) throws GameRuleException {
        Optional<StackItem> top = game.getStack().peek();
        if (top.isEmpty() || !(top.get() instanceof StackItem.Spell spell)
                || spell.getControllerSeat() == player.getSeat() || spell.isCountered()) {
            return false;
        }
        for (Card card : player.getHand().getCards()) {
            if (!card.isInstant() && !card.hasKeyword(Keyword.FLASH)) {
                continue;
            }
            boolean counters = game.getAbilityParser().parseSpellEffects(card).stream()
                    .anyMatch(e -> e.type() == EffectType.COUNTER_SPELL);
            if (!counters || !ManaPlanner.canAfford(player, card.getParsedManaCost())) {
                continue;
            }
            ManaPlanner.produce(game, player, card.getParsedManaCost());
            game.getSpellCastingEngine().counterSpell(card, player, spell);
            log.debug("{} counters {} with {}", player.getName(), spell.getName(), card.getName());
            return true;
        }
        return false;
    }

    private boolean castBestSpell(Game game, Player player) throws GameRuleException {
        List<Card> candidates = new ArrayList<>();
        for (Card card : player.getHand().getCards()) {
            if (!card.isLand()) {
                candidates.add(card);
            }
        }
        candidates.sort(Comparator.comparingInt(Card::getManaValue).reversed());

        for (Card card : candidates) {
            if (!ManaPlanner.canAfford(player, card.getParsedManaCost())) {
                continue;
            }
            List<Effect> effects = card.isPermanentCard()
                    ? List.of()
                    : game.getAbilityParser().parseSpellEffects(card);
            List<Target> targets = List.of();
            if (hasTargetedEffect(effects)) {
                targets = chooseTargetsFor(game, player, effects, card.getColors(), card.isArtifact());
                if (targets.isEmpty()) {
                    continue;
                }
            }
            ManaPlanner.produce(game, player, card.getParsedManaCost());
            game.getSpellCastingEngine().castSpell(card, player, targets);
            return true;
        }
        return false;
    }

    private boolean activateAbility(Game game, Player player) throws GameRuleException {
        for (Permanent permanent : player.getBattlefield().getAll()) {
            for (Ability ability : permanent.getAbilities()) {
                if (ability.kind() != Ability.Kind.ACTIVATED || ability.cost().life() > 0) {
                    continue;
                }
                // Free untapped abilities could be activated forever
                if (!ability.cost().tap() && ability.cost().mana().isZero()) {
                    continue;
                }
                if (ability.cost().tap() && (permanent.isTapped() || !permanent.canUseTapAbilities())) {
                    continue;
                }
                Optional<List<ManaPlanner.Activation>> plan = ManaPlanner.plan(player, ability.cost().mana());
                if (plan.isEmpty() || (ability.cost().tap() && usesSource(plan.get(), permanent))) {
                    continue;
                }
                List<Target> targets = List.of();
                if (ability.isTargeted()) {
                    targets = chooseTargetsFor(game, player, ability.effects(),
                            permanent.getColors(), permanent.isArtifact());
                    if (targets.isEmpty()) {
                        continue;
                    }
                }
                ManaPlanner.activate(game, player, plan.get());
                game.getSpellCastingEngine().activateAbility(permanent, ability, player, targets);
                return true;
            }
        }
        return false;
    }

    private static boolean usesSource(List<ManaPlanner.Activation> plan, Permanent permanent) {
        for (ManaPlanner.Activation activation : plan) {
            if (activation.source().getId() == permanent.getId()) {
                return true;
            }
        }
        return false;
    }

    // ---- Combat ----

    @Override
    public List<Permanent> chooseAttackers(Game game, Player player, Player defender) {
        CombatResolver combat = game.getCombatResolver();
        List<Permanent> attackers = new ArrayList<>();
        for (Permanent creature : player.getBattlefield().getCreatures()) {
            if (combat.canAttack(creature) && (creature.getPower() > 0 || creature.isGoaded())) {
                attackers.add(creature);
            }
        }
        return attackers;
    }

    @Override
    public List<CombatResolver.Block> chooseBlocks(Game game, Player defender, List<Permanent> attackers) {
        CombatResolver combat = game.getCombatResolver();
        List<Permanent> available = new ArrayList<>();
        for (Permanent creature : defender.getBattlefield().getCreatures()) {
            if (!creature.isTapped()) {
                available.add(creature);
            }
        }

        List<Permanent> sorted = new ArrayList<>(attackers);
        sorted.sort(Comparator.comparingInt(Permanent::getPower).reversed());
        int incoming = 0;
        for (Permanent attacker : sorted) {
            incoming += attacker.getPower();
        }

        List<CombatResolver.Block> blocks = new ArrayList<>();
        for (Permanent attacker : sorted) {
            // A single blocker is never legal against menace
            if (attacker.hasKeyword(Keyword.MENACE)) {
                continue;
            }
            // Prefer a blocker that kills the attacker and survives, then a trade
            Permanent chosen = null;
            for (Permanent blocker : available) {
                if (!combat.canBlock(attacker, blocker) || !kills(blocker, attacker)) {
                    continue;
                }
                if (chosen == null || (kills(attacker, chosen) && !kills(attacker, blocker))) {
                    chosen = blocker;
                }
            }
            if (chosen == null && incoming >= defender.getLife()) {
                // Chump with the smallest legal blocker
                for (Permanent blocker : available) {
                    if (combat.canBlock(attacker, blocker)
                            && (chosen == null || blocker.getPower() < chosen.getPower())) {
                        chosen = blocker;
                    }
                }
            }
            if (chosen != null) {
                blocks.add(new CombatResolver.Block(chosen, attacker));
                available.remove(chosen);
                if (!attacker.hasKeyword(Keyword.TRAMPLE)) {
                    incoming -= attacker.getPower();
                }
            }
        }
        return blocks;
    }

    private static boolean kills(Permanent source, Permanent target) {
        if (target.hasKeyword(Keyword.INDESTRUCTIBLE)) {
            return false;
        }
        if (source.getPower() > 0 && source.hasKeyword(Keyword.DEATHTOUCH)) {
            return true;
        }
        return source.getPower() >= target.getLethalDamageRemaining();
    }

    // ---- Targets and discards ----

    @Override
    public List<Target> chooseTargets(Game game, Player controller, List<Effect> effects) {
        return chooseTargetsFor(game, controller, effects, ColorFlags.COLORLESS, false);
    }

    private List<Target> chooseTargetsFor(Game game, Player controller, List<Effect> effects,
                                          ColorFlags colors, boolean artifact) {
        List<Target> targets = new ArrayList<>();
        for (Effect effect : effects) {
            if (!effect.target().isTargeted()) {
                continue;
            }
            Optional<Target> target = chooseTarget(game, controller, effect, colors, artifact);
            if (target.isEmpty()) {
                return List.of();
            }
            targets.add(target.get());
        }
        return targets;
    }

    private Optional<Target> chooseTarget(Game game, Player controller, Effect effect,
                                          ColorFlags colors, boolean artifact) {
        TargetValidator validator = game.getTargetValidator();
        TargetSpec spec = effect.target();
        int seat = controller.getSeat();
        Player opponent = game.getOpponent(controller);
        boolean harmful = isHarmful(effect);

        List<Target> candidates = new ArrayList<>();
        switch (spec) {
            case TARGET_SPELL -> {
                for (StackItem item : game.getStack().getItems()) {
                    if (item.getControllerSeat() != seat) {
                        candidates.add(Target.spell(item.getId()));
                    }
                }
            }
            case TARGET_PLAYER -> candidates.add(Target.player(harmful ? opponent.getSeat() : seat));
            case ANY_TARGET, TARGET_CREATURE, TARGET_PERMANENT -> {
                Player side = harmful ? opponent : controller;
                List<Permanent> permanents = spec == TargetSpec.TARGET_PERMANENT
                        ? new ArrayList<>(side.getBattlefield().getAll())
                        : new ArrayList<>(side.getBattlefield().getCreatures());
                permanents.sort(Comparator.comparingInt(SimpleStrategy::threat).reversed());
                for (Permanent permanent : permanents) {
                    if (effect instanceof Effect.DealDamage damage
                            && damage.amount() < permanent.getLethalDamageRemaining()) {
                        continue;
                    }
                    candidates.add(Target.permanent(permanent.getId()));
                }
                if (spec == TargetSpec.ANY_TARGET) {
                    candidates.add(Target.player(harmful ? opponent.getSeat() : seat));
                }
            }
            default -> {
                return Optional.empty();
            }
        }

        for (Target candidate : candidates) {
            if (validator.isLegal(candidate, spec, seat, colors, artifact)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean hasTargetedEffect(List<Effect> effects) {
        for (Effect effect : effects) {
            if (effect.target().isTargeted()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isHarmful(Effect effect) {
        if (HARMFUL.contains(effect.type())) {
            return true;
        }
        if (effect instanceof Effect.TapPermanent tap) {
            return !tap.untap();
        }
        if (effect instanceof Effect.ModifyStats stats) {
            return stats.toughness() < 0;
        }
        return false;
    }

    private static int threat(Permanent permanent) {
        return permanent.isCreature()
                ? permanent.getPower() * 2 + permanent.getToughness()
                : permanent.isLand() ? 0 : permanent.getCard().getManaValue();
    }

    @Override
    public List<Card> chooseDiscards(Game game, Player player, int count) {
        List<Card> hand = new ArrayList<>(player.getHand().getCards());
        hand.sort(Comparator.comparingInt(Card::getManaValue).reversed());
        return new ArrayList<>(hand.subList(0, Math.min(count, hand.size())));
    }
}
