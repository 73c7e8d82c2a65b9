package com.mtg.sim.game;

import com.mtg.sim.ability.Effect;
import com.mtg.sim.ability.Target;
import com.mtg.sim.card.Card;
import com.mtg.sim.game.combat.CombatResolver;
import com.mtg.sim.game.zones.Permanent;

import java.util.List;
import java.util.Optional;

/**
 * Decisions a player makes during a game. The turn driver asks for them and the
 * rules engine validates whatever comes back.
 */
public interface PlayerStrategy {

    /**
     * Land to play this main phase, if any.
     */
    Optional<Card> chooseLand(Game game, Player player);

    /**
     * Called while the player holds priority. Cast spells or activate abilities through
     * the game's engine and return true, or return false to pass.
     */
    boolean onPriority(Game game, Player player, Step step);

    List<Permanent> chooseAttackers(Game game, Player player, Player defender);

    List<CombatResolver.Block> chooseBlocks(Game game, Player defender, List<Permanent> attackers);

    /**
     * Targets for the targeted effects of a triggered ability or spell, in effect order.
     * An empty list means no legal choice exists.
     */
    List<Target> chooseTargets(Game game, Player controller, List<Effect> effects);

    List<Card> chooseDiscards(Game game, Player player, int count);
}
