package com.mtg.sim.game;

import com.mtg.sim.GameFixtures;
import com.mtg.sim.card.CardDatabase;
import com.mtg.sim.game.zones.Permanent;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.mtg.sim.GameFixtures.card;
import static com.mtg.sim.GameFixtures.onBattlefield;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TurnDriver.
 */
class TurnDriverTest {

    private static CardDatabase db;

    @BeforeAll
    static void loadCards() throws Exception {
        db = GameFixtures.testDatabase();
    }

    @Test
    void testUntapStepUntapsActivePlayerOnly() {
        Game game = GameFixtures.newGame(db);
        Player alice = game.getPlayer(0);
        Player bob = game.getPlayer(1);
        Permanent aliceForest = onBattlefield(game, alice, card(db, "Forest"));
        Permanent bobForest = onBattlefield(game, bob, card(db, "Forest"));
        Permanent fresh = game.putOntoBattlefield(card(db, "Grizzly Bears"), alice);
        aliceForest.tap();
        bobForest.tap();

        new TurnDriver(game).playStep(Step.UNTAP, new TurnContext(3, alice, bob, false));

        assertFalse(aliceForest.isTapped());
        assertTrue(bobForest.isTapped());
        assertFalse(fresh.isSummoningSick());
    }

    @Test
    void testGoadEndsWhenGoadingPlayersTurnBegins() {
        Game game = GameFixtures.newGame(db);
        Player alice = game.getPlayer(0);
        Player bob = game.getPlayer(1);
        Permanent bears = onBattlefield(game, alice, card(db, "Grizzly Bears"));
        bears.goad(bob.getSeat());
        TurnDriver driver = new TurnDriver(game);

        driver.playStep(Step.UNTAP, new TurnContext(2, alice, bob, false));
        assertTrue(bears.isGoaded());

        driver.playStep(Step.UNTAP, new TurnContext(3, bob, alice, false));
        assertFalse(bears.isGoaded());
    }
}
