package com.mtg.sim.game;

import com.mtg.sim.card.Keyword;
import com.mtg.sim.game.zones.Permanent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds and applies state-based actions until none apply. A second run with no
 * state change in between does nothing.
 */
public class StateBasedActionChecker {
    private static final Logger log = LoggerFactory.getLogger(StateBasedActionChecker.class);

    /**
     * Run all state-based actions to a fixed point.
     * @return creatures that died and players who lost during this run
     */
    public SbaResult check(Game game) {
        List<Permanent> died = new ArrayList<>();
        List<Player> losers = new ArrayList<>();

        boolean changed = true;
        while (changed) {
            changed = false;

            for (Player player : game.getPlayers()) {
                if (player.hasLost()) {
                    continue;
                }
                if (player.getLife() <= 0 || player.hasDrawnFromEmptyLibrary()) {
                    player.markLost();
                    losers.add(player);
                    changed = true;
                    log.info("{} loses ({})", player.getName(),
                            player.getLife() <= 0 ? "life " + player.getLife() : "drew from empty library");
                }
            }

            List<Permanent> dying = new ArrayList<>();
            for (Player player : game.getPlayers()) {
                for (Permanent creature : player.getBattlefield().getCreatures()) {
                    if (isLethallyDamaged(creature)) {
                        dying.add(creature);
                    }
                }
            }
            // All simultaneous deaths happen together
            for (Permanent creature : dying) {
                game.movePermanentToGraveyard(creature);
                died.add(creature);
                changed = true;
                log.debug("{} dies (damage {}, toughness {})",
                        creature.getName(), creature.getDamage(), creature.getToughness());
            }
        }

        if (died.isEmpty() && losers.isEmpty()) {
            return SbaResult.NONE;
        }
        return new SbaResult(died, losers);
    }

    /**
     * Whether a creature must be put into the graveyard right now.
     */
    public static boolean isLethallyDamaged(Permanent creature) {
        if (creature.getToughness() <= 0) {
            return true;
        }
        if (creature.hasKeyword(Keyword.INDESTRUCTIBLE)) {
            return false;
        }
        return creature.getDamage() >= creature.getToughness()
                || (creature.isDeathtouchDamaged() && creature.getDamage() > 0);
    }
}
