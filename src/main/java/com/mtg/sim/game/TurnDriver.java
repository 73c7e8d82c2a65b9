package com.mtg.sim.game;

import com.mtg.sim.ability.TriggerCondition;
import com.mtg.sim.card.Card;
import com.mtg.sim.game.combat.CombatResolver;
import com.mtg.sim.game.zones.Permanent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Walks a turn through its steps, asking each player's strategy for decisions and
 * handing them to the rules engine.
 */
public class TurnDriver {
    private static final Logger log = LoggerFactory.getLogger(TurnDriver.class);

    private final Game game;
    private final SpellCastingEngine engine;
    private final CombatResolver combat;
    private boolean attackersDeclared;

    public TurnDriver(Game game) {
        this.game = game;
        this.engine = game.getSpellCastingEngine();
        this.combat = game.getCombatResolver();
    }

    public void playTurn(TurnContext turn) {
        log.debug("=== Turn {}: {} ===", turn.turnNumber(), turn.activePlayer());
        attackersDeclared = false;
        for (Step step : Step.values()) {
            if (game.isOver()) {
                return;
            }
            // Without attackers the blockers and damage steps are skipped
            if (!attackersDeclared && (step == Step.DECLARE_BLOCKERS || step == Step.COMBAT_DAMAGE)) {
                continue;
            }
            playStep(step, turn);
        }
    }

    /**
     * Play one step of the turn. Mana pools empty when the step ends.
     */
    public void playStep(Step step, TurnContext turn) {
        Player active = turn.activePlayer();
        game.enterStep(active, step);

        switch (step) {
            case UNTAP -> {
                active.getBattlefield().untapAll();
                active.resetTurnState();
                for (Player player : game.getPlayers()) {
                    for (Permanent permanent : player.getBattlefield().getAll()) {
                        permanent.endGoadFrom(active.getSeat());
                    }
                }
            }
            case UPKEEP -> {
                engine.fireStepTriggers(TriggerCondition.BEGINNING_OF_UPKEEP, active);
                priorityRound(step);
            }
            case DRAW -> {
                if (!turn.firstTurnOfGame()) {
                    active.drawCard();
                    game.checkStateBasedActions();
                }
                priorityRound(step);
            }
            case MAIN1, MAIN2 -> {
                playLand(active);
                priorityRound(step);
            }
            case BEGIN_COMBAT -> priorityRound(step);
            case DECLARE_ATTACKERS -> {
                attackersDeclared = declareAttackers(active, turn.defendingPlayer());
                if (attackersDeclared) {
                    priorityRound(step);
                }
            }
            case DECLARE_BLOCKERS -> {
                declareBlockers(turn.defendingPlayer());
                priorityRound(step);
            }
            case COMBAT_DAMAGE -> {
                combat.resolveCombatDamage();
                priorityRound(step);
            }
            case END_COMBAT -> {
                priorityRound(step);
                combat.endCombat();
            }
            case END -> {
                engine.fireStepTriggers(TriggerCondition.END_STEP, active);
                priorityRound(step);
            }
            case CLEANUP -> cleanup(active);
        }

        for (Player player : game.getPlayers()) {
            player.getManaPool().clear();
        }
    }

    private void playLand(Player active) {
        Optional<Card> land = game.getStrategy(active.getSeat()).chooseLand(game, active);
        if (land.isEmpty()) {
            return;
        }
        try {
            game.playLand(active, land.get());
            game.checkStateBasedActions();
        } catch (IllegalTimingException e) {
            log.debug("{} cannot play {}: {}", active.getName(), land.get().getName(), e.getMessage());
        }
    }

    private boolean declareAttackers(Player active, Player defender) {
        List<Permanent> attackers = game.getStrategy(active.getSeat()).chooseAttackers(game, active, defender);
        try {
            combat.declareAttackers(active, attackers, defender);
        } catch (IllegalAttackException e) {
            log.debug("Attack by {} rejected ({}); attacking with required creatures only",
                    active.getName(), e.getMessage());
            attackers = combat.getRequiredAttackers(active);
            try {
                combat.declareAttackers(active, attackers, defender);
            } catch (IllegalAttackException fallback) {
                throw new IllegalStateException("Required attackers were rejected", fallback);
            }
        }
        return !attackers.isEmpty();
    }

    private void declareBlockers(Player defender) {
        List<Permanent> attackers = combat.getAttackers();
        List<CombatResolver.Block> blocks = game.getStrategy(defender.getSeat())
                .chooseBlocks(game, defender, attackers);
        try {
            combat.declareBlockers(defender, blocks);
        } catch (IllegalBlockException e) {
            log.debug("Blocks by {} rejected ({}); no blocks declared", defender.getName(), e.getMessage());
        }
    }

    private void cleanup(Player active) {
        int excess = active.getHand().size() - game.getConfig().maxHandSize();
        if (excess > 0) {
            List<Card> discards = game.getStrategy(active.getSeat()).chooseDiscards(game, active, excess);
            for (Card card : discards) {
                active.discard(card);
            }
            log.debug("{} discards {} card(s)", active.getName(), discards.size());
        }
        for (Player player : game.getPlayers()) {
            for (Permanent permanent : player.getBattlefield().getAll()) {
                permanent.endOfTurnCleanup();
            }
        }
    }

    /**
     * Let players act until everyone passes with an empty stack.
     */
    private void priorityRound(Step step) {
        PriorityManager priority = game.getPriorityManager();
        int budget = game.getConfig().maxActionsPerStep();
        for (int actions = 0; !game.isOver(); actions++) {
            if (actions >= budget) {
                log.warn("Action budget of {} reached in {}; resolving the stack and ending the step", budget, step);
                engine.resolveStack();
                return;
            }
            Player holder = game.getPlayer(priority.getHolderSeat());
            if (game.getStrategy(holder.getSeat()).onPriority(game, holder, step)) {
                continue;
            }
            if (engine.passPriority(holder) == PassOutcome.STEP_ENDS) {
                return;
            }
        }
    }
}
