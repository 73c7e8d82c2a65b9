package com.mtg.sim;

import com.mtg.sim.ability.AbilityParser;
import com.mtg.sim.ability.OracleTextAbilityParser;
import com.mtg.sim.card.Card;
import com.mtg.sim.card.CardDatabase;
import com.mtg.sim.card.CardDatabaseException;
import com.mtg.sim.game.Game;
import com.mtg.sim.game.GameConfig;
import com.mtg.sim.game.Player;
import com.mtg.sim.game.zones.Permanent;
import com.mtg.sim.rng.GameRng;

import java.util.List;

/**
 * Shared setup for tests that need a game in a particular state.
 */
public final class GameFixtures {
    public static final AbilityParser PARSER = new OracleTextAbilityParser();

    private GameFixtures() {
        // Utility class - prevent instantiation
    }

    public static CardDatabase testDatabase() throws CardDatabaseException {
        return CardDatabase.fromResource("cards-test.json");
    }

    /**
     * A game with players Alice (seat 0) and Bob (seat 1) and empty libraries.
     * The game is not started; tests move it into steps with {@link Game#enterStep}.
     */
    public static Game newGame(CardDatabase db) {
        Game game = new Game(db, PARSER, GameConfig.DEFAULT, new GameRng(42));
        game.addPlayer("Alice", List.of());
        game.addPlayer("Bob", List.of());
        return game;
    }

    /**
     * Put a card onto the battlefield as if it had been there since last turn.
     */
    public static Permanent onBattlefield(Game game, Player owner, Card card) {
        Permanent permanent = game.putOntoBattlefield(card, owner);
        permanent.setSummoningSick(false);
        return permanent;
    }

    public static Card creature(String name, String manaCost, int power, int toughness, String... keywords) {
        return new Card(name, manaCost, "Creature — Test", "",
                String.valueOf(power), String.valueOf(toughness), List.of(keywords));
    }

    public static Card artifactCreature(String name, int power, int toughness) {
        return new Card(name, "{3}", "Artifact Creature — Golem", "",
                String.valueOf(power), String.valueOf(toughness), List.of());
    }

    public static Card card(CardDatabase db, String name) {
        return db.getCardByName(name).orElseThrow();
    }
}
