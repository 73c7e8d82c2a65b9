package com.mtg.sim.game.combat;

import com.mtg.sim.card.Keyword;
import com.mtg.sim.card.ManaType;
import com.mtg.sim.game.Game;
import com.mtg.sim.game.IllegalAttackException;
import com.mtg.sim.game.IllegalBlockException;
import com.mtg.sim.game.Player;
import com.mtg.sim.game.zones.Permanent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Attack and block legality plus staged combat damage.
 */
public class CombatResolver {
    private static final Logger log = LoggerFactory.getLogger(CombatResolver.class);

    /**
     * One blocker assigned to one attacker. Blocks for the same attacker are
     * ordered as declared, which is also the damage assignment order.
     */
    public record Block(Permanent blocker, Permanent attacker) {
    }

    private final Game game;

    public CombatResolver(Game game) {
        this.game = game;
    }

    // ---- Legality ----

    /**
     * Whether the blocker may block the attacker, checking evasion keywords in order
     * and then the attacker's protection. Menace is checked for the whole declaration.
     */
    public boolean canBlock(Permanent attacker, Permanent blocker) {
        if (!blocker.isCreature() || blocker.isTapped()) {
            return false;
        }
        if (attacker.hasKeyword(Keyword.FLYING)
                && !blocker.hasKeyword(Keyword.FLYING) && !blocker.hasKeyword(Keyword.REACH)) {
            return false;
        }
        if (attacker.hasKeyword(Keyword.INTIMIDATE)
                && !blocker.isArtifact() && !blocker.getColors().sharesColorWith(attacker.getColors())) {
            return false;
        }
        if (attacker.hasKeyword(Keyword.SHADOW) != blocker.hasKeyword(Keyword.SHADOW)) {
            return false;
        }
        if (attacker.hasKeyword(Keyword.FEAR)
                && !blocker.isArtifact() && !blocker.getColors().contains(ManaType.BLACK)) {
            return false;
        }
        if (attacker.hasKeyword(Keyword.HORSEMANSHIP) && !blocker.hasKeyword(Keyword.HORSEMANSHIP)) {
            return false;
        }
        return !attacker.isProtectedFrom(blocker.getColors(), blocker.isArtifact());
    }

    /**
     * Whether a creature is able to attack this turn.
     */
    public boolean canAttack(Permanent creature) {
        return creature.isCreature()
                && !creature.isTapped()
                && creature.canUseTapAbilities()
                && !creature.hasKeyword(Keyword.DEFENDER);
    }

    /**
     * Goaded creatures that are able to attack and therefore must.
     */
    public List<Permanent> getRequiredAttackers(Player player) {
        List<Permanent> required = new ArrayList<>();
        for (Permanent creature : player.getBattlefield().getCreatures()) {
            if (creature.isGoaded() && canAttack(creature)) {
                required.add(creature);
            }
        }
        return required;
    }

    /**
     * Declare attackers. Attackers without vigilance become tapped.
     *
     * @throws IllegalAttackException if any attacker cannot attack or a goaded creature is left out;
     *                                nothing is changed in that case
     */
    public void declareAttackers(Player attackingPlayer, List<Permanent> attackers, Player defender)
            throws IllegalAttackException {
        Set<Long> seen = new HashSet<>();
        for (Permanent attacker : attackers) {
            if (attacker.getControllerSeat() != attackingPlayer.getSeat()
                    || !attackingPlayer.getBattlefield().contains(attacker.getId())) {
                throw new IllegalAttackException(attacker.getName() + " is not controlled by "
                        + attackingPlayer.getName());
            }
            if (!seen.add(attacker.getId())) {
                throw new IllegalAttackException(attacker.getName() + " is declared twice");
            }
            if (!attacker.isCreature()) {
                throw new IllegalAttackException(attacker.getName() + " is not a creature");
            }
            if (attacker.isTapped()) {
                throw new IllegalAttackException(attacker.getName() + " is tapped");
            }
            if (!attacker.canUseTapAbilities()) {
                throw new IllegalAttackException(attacker.getName() + " has summoning sickness");
            }
            if (attacker.hasKeyword(Keyword.DEFENDER)) {
                throw new IllegalAttackException(attacker.getName() + " has defender");
            }
        }
        for (Permanent required : getRequiredAttackers(attackingPlayer)) {
            if (!seen.contains(required.getId())) {
                throw new IllegalAttackException(required.getName() + " is goaded and must attack");
            }
        }

        for (Permanent attacker : attackers) {
            if (!attacker.hasKeyword(Keyword.VIGILANCE)) {
                attacker.tap();
            }
            attacker.setAttackingSeat(defender.getSeat());
            log.debug("{} attacks {}", attacker, defender.getName());
        }
    }

    /**
     * Declare blockers for the defending player.
     *
     * @throws IllegalBlockException if a block is illegal or a menace attacker has exactly one blocker;
     *                               nothing is changed in that case
     */
    public void declareBlockers(Player defender, List<Block> blocks) throws IllegalBlockException {
        Set<Long> blockersUsed = new HashSet<>();
        Map<Long, Integer> blockerCounts = new HashMap<>();

        for (Block block : blocks) {
            Permanent blocker = block.blocker();
            Permanent attacker = block.attacker();
            if (blocker.getControllerSeat() != defender.getSeat()
                    || !defender.getBattlefield().contains(blocker.getId())) {
                throw new IllegalBlockException(blocker.getName() + " is not controlled by " + defender.getName());
            }
            if (!attacker.isAttacking() || attacker.getAttackingSeat() != defender.getSeat()) {
                throw new IllegalBlockException(attacker.getName() + " is not attacking " + defender.getName());
            }
            if (!blockersUsed.add(blocker.getId())) {
                throw new IllegalBlockException(blocker.getName() + " cannot block more than one attacker");
            }
            if (!canBlock(attacker, blocker)) {
                throw new IllegalBlockException(blocker.getName() + " cannot block " + attacker.getName());
            }
            blockerCounts.merge(attacker.getId(), 1, Integer::sum);
        }
        for (Block block : blocks) {
            Permanent attacker = block.attacker();
            if (attacker.hasKeyword(Keyword.MENACE) && blockerCounts.get(attacker.getId()) == 1) {
                throw new IllegalBlockException(attacker.getName() + " has menace and needs two or more blockers");
            }
        }

        for (Block block : blocks) {
            block.blocker().setBlockingId(block.attacker().getId());
            block.attacker().addBlocker(block.blocker().getId());
            log.debug("{} blocks {}", block.blocker(), block.attacker());
        }
    }

    public List<Permanent> getAttackers() {
        List<Permanent> attackers = new ArrayList<>();
        for (Player player : game.getPlayers()) {
            for (Permanent creature : player.getBattlefield().getCreatures()) {
                if (creature.isAttacking()) {
                    attackers.add(creature);
                }
            }
        }
        return attackers;
    }

    private List<Permanent> getBlockers() {
        List<Permanent> blockers = new ArrayList<>();
        for (Player player : game.getPlayers()) {
            for (Permanent creature : player.getBattlefield().getCreatures()) {
                if (creature.isBlocking()) {
                    blockers.add(creature);
                }
            }
        }
        return blockers;
    }

    // ---- Damage ----

    /**
     * Run combat damage: first-strike damage, state-based actions, regular damage,
     * state-based actions.
     *
     * @return the states visited, ending with DONE
     */
    public List<CombatDamageStep> resolveCombatDamage() {
        List<CombatDamageStep> visited = new ArrayList<>(5);
        CombatDamageStep state = CombatDamageStep.FIRST_STRIKE_DAMAGE;
        while (state != CombatDamageStep.DONE) {
            visited.add(state);
            switch (state) {
                case FIRST_STRIKE_DAMAGE -> applyDamage(computeDamage(true));
                case REGULAR_DAMAGE -> applyDamage(computeDamage(false));
                case CLEANUP_1, CLEANUP_2 -> game.checkStateBasedActions();
                case DONE -> throw new IllegalStateException("unreachable");
            }
            state = game.isOver() ? CombatDamageStep.DONE : state.next();
        }
        visited.add(CombatDamageStep.DONE);
        return visited;
    }

    private static boolean dealsDamageInStep(Permanent creature, boolean firstStrikeStep) {
        boolean firstStrike = creature.hasKeyword(Keyword.FIRST_STRIKE);
        boolean doubleStrike = creature.hasKeyword(Keyword.DOUBLE_STRIKE);
        return firstStrikeStep ? firstStrike || doubleStrike : !firstStrike || doubleStrike;
    }

    /**
     * Work out every damage assignment for one step before anything is dealt.
     */
    List<DamageEvent> computeDamage(boolean firstStrikeStep) {
        List<DamageEvent> events = new ArrayList<>();

        for (Permanent attacker : getAttackers()) {
            int power = attacker.getPower();
            if (power <= 0 || !dealsDamageInStep(attacker, firstStrikeStep)) {
                continue;
            }
            Player defender = game.getPlayer(attacker.getAttackingSeat());
            boolean trample = attacker.hasKeyword(Keyword.TRAMPLE);

            if (!attacker.wasBlocked()) {
                events.add(DamageEvent.toPlayer(attacker, defender, power));
                continue;
            }

            List<Permanent> blockers = new ArrayList<>();
            for (long blockerId : attacker.getBlockedByIds()) {
                game.findPermanent(blockerId).ifPresent(blockers::add);
            }
            if (blockers.isEmpty()) {
                // Blocked creatures stay blocked; only trample gets damage through
                if (trample) {
                    events.add(DamageEvent.toPlayer(attacker, defender, power));
                }
                continue;
            }

            boolean deathtouch = attacker.hasKeyword(Keyword.DEATHTOUCH);
            int remaining = power;
            for (int i = 0; i < blockers.size() && remaining > 0; i++) {
                Permanent blocker = blockers.get(i);
                boolean last = i == blockers.size() - 1;
                int lethal = deathtouch
                        ? Math.min(1, blocker.getLethalDamageRemaining())
                        : blocker.getLethalDamageRemaining();
                int assigned = last && !trample ? remaining : Math.min(lethal, remaining);
                if (assigned > 0) {
                    events.add(DamageEvent.toCreature(attacker, blocker, assigned));
                }
                remaining -= assigned;
            }
            if (remaining > 0) {
                if (trample) {
                    events.add(DamageEvent.toPlayer(attacker, defender, remaining));
                } else {
                    events.add(DamageEvent.toCreature(attacker, blockers.get(blockers.size() - 1), remaining));
                }
            }
        }

        for (Permanent blocker : getBlockers()) {
            int power = blocker.getPower();
            if (power <= 0 || !dealsDamageInStep(blocker, firstStrikeStep)) {
                continue;
            }
            Optional<Permanent> attacker = game.findPermanent(blocker.getBlockingId());
            if (attacker.isPresent() && attacker.get().isAttacking()) {
                events.add(DamageEvent.toCreature(blocker, attacker.get(), power));
            }
        }
        return events;
    }

    private void applyDamage(List<DamageEvent> events) {
        for (DamageEvent event : events) {
            Permanent source = event.source();
            Player controller = game.getPlayer(source.getControllerSeat());
            if (event.targetPlayer() != null) {
                event.targetPlayer().loseLife(event.amount());
                log.debug("{} deals {} combat damage to {} ({} life)",
                        source, event.amount(), event.targetPlayer().getName(), event.targetPlayer().getLife());
            } else {
                Permanent target = event.targetCreature();
                if (target.isProtectedFrom(source.getColors(), source.isArtifact())) {
                    log.debug("Damage from {} to {} is prevented by protection", source, target);
                    continue;
                }
                target.dealDamage(event.amount(), source.hasKeyword(Keyword.DEATHTOUCH));
                log.debug("{} deals {} combat damage to {}", source, event.amount(), target);
            }
            if (source.hasKeyword(Keyword.LIFELINK)) {
                controller.gainLife(event.amount());
            }
        }
    }

    /**
     * Clear attacking and blocking state at the end of combat.
     */
    public void endCombat() {
        for (Player player : game.getPlayers()) {
            for (Permanent permanent : player.getBattlefield().getAll()) {
                permanent.clearCombatState();
            }
        }
    }

    /**
     * Damage one source assigns in a step; exactly one of the targets is set.
     */
    record DamageEvent(Permanent source, Player targetPlayer, Permanent targetCreature, int amount) {
        static DamageEvent toPlayer(Permanent source, Player player, int amount) {
            return new DamageEvent(source, player, null, amount);
        }

        static DamageEvent toCreature(Permanent source, Permanent creature, int amount) {
            return new DamageEvent(source, null, creature, amount);
        }
    }
}
