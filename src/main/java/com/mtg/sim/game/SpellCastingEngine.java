package com.mtg.sim.game;

import com.mtg.sim.ability.Ability;
import com.mtg.sim.ability.Effect;
import com.mtg.sim.ability.EffectType;
import com.mtg.sim.ability.Target;
import com.mtg.sim.ability.TimingRestriction;
import com.mtg.sim.ability.TriggerCondition;
import com.mtg.sim.card.Card;
import com.mtg.sim.card.Keyword;
import com.mtg.sim.card.ManaType;
import com.mtg.sim.game.zones.Permanent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Casting, activation, countering and resolution of everything that uses the stack.
 * Rule checks run before any payment, so a rejected action leaves the game untouched.
 */
public class SpellCastingEngine {
    private static final Logger log = LoggerFactory.getLogger(SpellCastingEngine.class);

    private final Game game;
    private final PriorityStack stack;
    private final PriorityManager priority;
    private final EffectResolver effectResolver;
    private final TargetValidator targetValidator;

    public SpellCastingEngine(Game game) {
        this.game = game;
        this.stack = game.getStack();
        this.priority = game.getPriorityManager();
        this.effectResolver = new EffectResolver(game);
        this.targetValidator = game.getTargetValidator();
    }

    // ---- Casting ----

    /**
     * Cast a spell from the caster's hand.
     *
     * @throws IllegalTimingException     if the spell cannot be cast now
     * @throws TargetInvalidException     if a required target is missing or illegal
     * @throws InsufficientManaException  if the caster's mana pool cannot pay the cost
     */
    public StackItem.Spell castSpell(Card card, Player caster, List<Target> targets)
            throws IllegalTimingException, TargetInvalidException, InsufficientManaException {
        List<Effect> effects = card.isPermanentCard() ? List.of() : game.getAbilityParser().parseSpellEffects(card);
        return cast(card, caster, targets, effects);
    }

    /**
     * Cast a counterspell targeting a spell on the stack. The target is only marked
     * countered when the counterspell resolves.
     *
     * @throws IllegalTimingException if the counterspell is neither an instant nor has flash
     * @throws TargetInvalidException if the target is not a spell on the stack
     */
    public StackItem.Spell counterSpell(Card counterCard, Player caster, StackItem targetItem)
            throws IllegalTimingException, TargetInvalidException, InsufficientManaException {
        if (!counterCard.isInstant() && !counterCard.hasKeyword(Keyword.FLASH)) {
            throw new IllegalTimingException(counterCard.getName() + " cannot be cast as an instant");
        }
        if (!(targetItem instanceof StackItem.Spell) || !stack.contains(targetItem.getId())) {
            throw new TargetInvalidException(targetItem + " is not a spell on the stack");
        }
        List<Effect> effects = new ArrayList<>(game.getAbilityParser().parseSpellEffects(counterCard));
        boolean hasCounter = effects.stream().anyMatch(e -> e.type() == EffectType.COUNTER_SPELL);
        if (!hasCounter) {
            effects.add(0, Effect.CounterSpell.TARGET_SPELL);
        }
        return cast(counterCard, caster, List.of(Target.spell(targetItem.getId())), effects);
    }

    private StackItem.Spell cast(Card card, Player caster, List<Target> targets, List<Effect> effects)
            throws IllegalTimingException, TargetInvalidException, InsufficientManaException {
        if (!caster.getHand().contains(card)) {
            throw new IllegalArgumentException(card.getName() + " is not in " + caster.getName() + "'s hand");
        }
        checkCastTiming(card, caster);
        targetValidator.validate(effects, targets, caster.getSeat(), card.getColors(), card.isArtifact());
        caster.getManaPool().pay(card.getParsedManaCost());

        caster.getHand().remove(card);
        StackItem.Spell spell = new StackItem.Spell(game.nextStackItemId(), caster.getSeat(), card, effects, targets);
        stack.push(spell);
        priority.actionTaken(caster.getSeat());
        log.debug("{} casts {} (stack size {})", caster.getName(), card.getName(), stack.size());
        return spell;
    }

    private void checkCastTiming(Card card, Player caster) throws IllegalTimingException {
        if (card.isLand()) {
            throw new IllegalTimingException(card.getName() + " is a land and is played, not cast");
        }
        if (!priority.holdsPriority(caster.getSeat())) {
            throw new IllegalTimingException(caster.getName() + " does not hold priority");
        }
        if (card.isInstant() || card.hasKeyword(Keyword.FLASH)) {
            return;
        }
        if (!isSorceryTiming(caster)) {
            throw new IllegalTimingException(card.getName() + " can only be cast in "
                    + caster.getName() + "'s main phase with an empty stack");
        }
    }

    private boolean isSorceryTiming(Player player) {
        return game.getCurrentStep().isMainPhase()
                && game.getActiveSeat() == player.getSeat()
                && stack.isEmpty();
    }

    // ---- Abilities ----

    /**
     * Activate an activated or mana ability of a permanent. Mana abilities resolve
     * immediately; other abilities go on the stack.
     *
     * @throws IllegalTimingException  if the ability's timing restriction is not met
     * @throws TargetInvalidException  if a required target is missing or illegal
     * @throws CostUnpayableException  if the source cannot be tapped, or mana or life is short
     */
    public void activateAbility(Permanent source, Ability ability, Player controller, List<Target> targets)
            throws IllegalTimingException, TargetInvalidException, CostUnpayableException {
        if (ability.kind() == Ability.Kind.MANA) {
            activateManaAbility(source, (Ability.Mana) ability, controller, null);
            return;
        }
        if (ability.kind() != Ability.Kind.ACTIVATED) {
            throw new IllegalArgumentException(ability.kind() + " abilities cannot be activated");
        }
        checkSource(source, ability, controller);
        checkActivationTiming(ability.timing(), controller);
        if (ability.cost().tap() && !source.canUseTapAbilities()) {
            throw new CostUnpayableException(source.getName() + " has summoning sickness");
        }
        targetValidator.validate(ability.effects(), targets, controller.getSeat(),
                source.getColors(), source.isArtifact());
        payCost(source, ability, controller);

        StackItem.AbilityItem item = new StackItem.AbilityItem(game.nextStackItemId(), controller.getSeat(),
                ability, source.getId(), source.getCard(), targets, true);
        stack.push(item);
        priority.actionTaken(controller.getSeat());
        log.debug("{} activates {}", controller.getName(), ability.name());
    }

    /**
     * Activate a mana ability without using the stack. Summoning sickness does not apply.
     *
     * @param requested the mana type wanted from a choice of types; null takes the first option
     */
    public void activateManaAbility(Permanent source, Ability.Mana ability, Player controller, ManaType requested)
            throws CostUnpayableException {
        checkSource(source, ability, controller);
        payCost(source, ability, controller);
        effectResolver.addMana(controller, ability.production(), requested);
    }

    private void checkSource(Permanent source, Ability ability, Player controller) {
        if (source.getControllerSeat() != controller.getSeat()) {
            throw new IllegalArgumentException(controller.getName() + " does not control " + source.getName());
        }
        if (!controller.getBattlefield().contains(source.getId())) {
            throw new IllegalArgumentException(source.getName() + " is not on the battlefield");
        }
        if (!source.getAbilities().contains(ability)) {
            throw new IllegalArgumentException(source.getName() + " has no ability " + ability.name());
        }
    }

    private void checkActivationTiming(TimingRestriction timing, Player controller) throws IllegalTimingException {
        if (!priority.holdsPriority(controller.getSeat())) {
            throw new IllegalTimingException(controller.getName() + " does not hold priority");
        }
        boolean allowed = switch (timing) {
            case ANY_TIME, INSTANT_SPEED -> true;
            case SORCERY_SPEED -> isSorceryTiming(controller);
            case ONLY_DURING_COMBAT -> game.getCurrentStep().isCombat();
            case ONLY_YOUR_TURN -> game.getActiveSeat() == controller.getSeat();
        };
        if (!allowed) {
            throw new IllegalTimingException("Cannot activate now (" + timing + ", step "
                    + game.getCurrentStep() + ")");
        }
    }

    private void payCost(Permanent source, Ability ability, Player controller) throws CostUnpayableException {
        if (ability.cost().tap() && source.isTapped()) {
            throw new CostUnpayableException(source.getName() + " is already tapped");
        }
        if (ability.cost().life() > controller.getLife()) {
            throw new CostUnpayableException(controller.getName() + " cannot pay " + ability.cost().life() + " life");
        }
        if (!controller.getManaPool().canPay(ability.cost().mana())) {
            throw new InsufficientManaException(ability.cost().mana(), controller.getManaPool());
        }
        controller.getManaPool().pay(ability.cost().mana());
        if (ability.cost().tap()) {
            source.tap();
        }
        if (ability.cost().life() > 0) {
            controller.loseLife(ability.cost().life());
        }
    }

    // ---- Triggers ----

    /**
     * Put a permanent's abilities for the given event on the stack. Triggers with
     * targets and no legal choice are dropped.
     */
    public void fireTriggers(TriggerCondition condition, Permanent source) {
        for (Ability.Triggered trigger : source.getTriggeredAbilities(condition)) {
            Player controller = game.getPlayer(source.getControllerSeat());
            List<Target> targets = List.of();
            if (trigger.isTargeted()) {
                targets = game.getStrategy(controller.getSeat()).chooseTargets(game, controller, trigger.effects());
                if (targets.isEmpty()) {
                    log.debug("{} has no legal target and is removed", trigger.name());
                    continue;
                }
            }
            // Death triggers resolve after their source has left
            boolean requiresSource = condition != TriggerCondition.DIES;
            stack.push(new StackItem.AbilityItem(game.nextStackItemId(), controller.getSeat(), trigger,
                    source.getId(), source.getCard(), targets, requiresSource));
            log.debug("{} triggers ({})", trigger.name(), condition);
        }
    }

    /**
     * Fire step-based triggers (upkeep, end step) of the given player's permanents.
     */
    public void fireStepTriggers(TriggerCondition condition, Player player) {
        for (Permanent permanent : player.getBattlefield().getAll()) {
            fireTriggers(condition, permanent);
        }
    }

    // ---- Priority and resolution ----

    /**
     * Pass priority, resolving the top of the stack when all players have passed.
     */
    public PassOutcome passPriority(Player player) {
        PassOutcome outcome = priority.passPriority(player.getSeat());
        if (outcome == PassOutcome.RESOLVE_TOP) {
            resolveTop();
        }
        return outcome;
    }

    /**
     * Resolve every item on the stack, top first.
     */
    public void resolveStack() {
        while (!stack.isEmpty()) {
            resolveTop();
        }
    }

    /**
     * Pop and resolve the top item, then run state-based actions.
     * @throws IllegalStateException if the stack is empty
     */
    public void resolveTop() {
        StackItem item = stack.pop();
        try {
            resolve(item);
        } finally {
            priority.resetToActivePlayer();
        }
        game.checkStateBasedActions();
    }

    private void resolve(StackItem item) {
        Player controller = game.getPlayer(item.getControllerSeat());

        if (item.isCountered()) {
            log.debug("{} was countered", item.getName());
            moveSpellToGraveyard(item);
            return;
        }

        Permanent sourcePermanent = null;
        if (item instanceof StackItem.AbilityItem abilityItem) {
            Optional<Permanent> source = game.findPermanent(abilityItem.getSourceId());
            if (abilityItem.requiresSource() && source.isEmpty()) {
                log.debug("{} fizzles: source left the battlefield", item.getName());
                return;
            }
            sourcePermanent = source.orElse(null);
        }

        EffectContext ctx = EffectContext.forStackItem(item, sourcePermanent);
        List<Effect> effects = item.getEffects();
        if (!item.getTargets().isEmpty() && allTargetsIllegal(item, ctx)) {
            log.debug("{} fizzles: no legal targets remain", item.getName());
            moveSpellToGraveyard(item);
            return;
        }

        List<Permanent> destroyed = new ArrayList<>();
        int targetedIndex = 0;
        for (Effect effect : effects) {
            Target target = null;
            if (effect.target().isTargeted()) {
                target = item.getTargetForEffect(targetedIndex++);
                if (!targetValidator.isLegal(target, effect.target(), ctx.controllerSeat(),
                        ctx.sourceColors(), ctx.sourceIsArtifact())) {
                    log.debug("{}: target {} is no longer legal, skipping {}", item.getName(), target, effect.type());
                    continue;
                }
            }
            destroyed.addAll(effectResolver.apply(effect, target, ctx));
        }

        if (item instanceof StackItem.Spell spell) {
            Card card = spell.getCard();
            if (card.isPermanentCard()) {
                Permanent permanent = game.putOntoBattlefield(card, controller);
                fireTriggers(TriggerCondition.ENTERS_THE_BATTLEFIELD, permanent);
            } else {
                controller.getGraveyard().add(card);
            }
        }
        log.debug("{} resolves", item.getName());

        for (Permanent dead : destroyed) {
            if (dead.isCreature()) {
                fireTriggers(TriggerCondition.DIES, dead);
            }
        }
    }

    private boolean allTargetsIllegal(StackItem item, EffectContext ctx) {
        int targetedIndex = 0;
        for (Effect effect : item.getEffects()) {
            if (!effect.target().isTargeted()) {
                continue;
            }
            Target target = item.getTargetForEffect(targetedIndex++);
            if (targetValidator.isLegal(target, effect.target(), ctx.controllerSeat(),
                    ctx.sourceColors(), ctx.sourceIsArtifact())) {
                return false;
            }
        }
        return targetedIndex > 0;
    }

    private void moveSpellToGraveyard(StackItem item) {
        if (item instanceof StackItem.Spell spell) {
            game.getPlayer(spell.getControllerSeat()).getGraveyard().add(spell.getCard());
        }
    }

    public EffectResolver getEffectResolver() {
        return effectResolver;
    }
}
