package com.mtg.sim.game;

import com.mtg.sim.GameFixtures;
import com.mtg.sim.card.CardDatabase;
import com.mtg.sim.game.zones.Permanent;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mtg.sim.GameFixtures.card;
import static com.mtg.sim.GameFixtures.onBattlefield;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StateBasedActionChecker.
 */
class StateBasedActionCheckerTest {

    private static CardDatabase db;

    private final StateBasedActionChecker checker = new StateBasedActionChecker();
    private Game game;
    private Player alice;
    private Player bob;

    @BeforeAll
    static void loadCards() throws Exception {
        db = GameFixtures.testDatabase();
    }

    @BeforeEach
    void setUp() {
        game = GameFixtures.newGame(db);
        alice = game.getPlayer(0);
        bob = game.getPlayer(1);
    }

    @Test
    void testLethalDamageKills() {
        Permanent bears = onBattlefield(game, alice, card(db, "Grizzly Bears"));
        bears.dealDamage(2, false);

        SbaResult result = checker.check(game);

        assertEquals(List.of(bears), result.died());
        assertTrue(alice.getBattlefield().isEmpty());
        assertTrue(alice.getGraveyard().contains("Grizzly Bears"));
    }

    @Test
    void testNonLethalDamageSurvives() {
        Permanent giant = onBattlefield(game, alice, card(db, "Hill Giant"));
        giant.dealDamage(2, false);

        assertFalse(checker.check(game).changedAnything());
        assertTrue(alice.getBattlefield().contains(giant.getId()));
    }

    @Test
    void testDeathtouchDamageKills() {
        Permanent giant = onBattlefield(game, bob, card(db, "Hill Giant"));
        giant.dealDamage(1, true);

        assertEquals(List.of(giant), checker.check(game).died());
    }

    @Test
    void testIndestructibleSurvivesDamage() {
        Permanent myr = onBattlefield(game, alice, card(db, "Darksteel Myr"));
        myr.dealDamage(4, false);

        assertTrue(checker.check(game).died().isEmpty());
        assertTrue(alice.getBattlefield().contains(myr.getId()));
        assertEquals(4, myr.getDamage());
        assertEquals(0, alice.getGraveyard().size());
    }

    @Test
    void testZeroToughnessDiesEvenIfIndestructible() {
        Permanent myr = onBattlefield(game, alice, card(db, "Darksteel Myr"));
        myr.modifyUntilEndOfTurn(0, -1);

        assertEquals(List.of(myr), checker.check(game).died());
    }

    @Test
    void testZeroLifeLoses() {
        bob.loseLife(20);

        SbaResult result = checker.check(game);

        assertEquals(List.of(bob), result.losers());
        assertTrue(bob.hasLost());
        assertFalse(alice.hasLost());
        assertTrue(game.isOver());
    }

    @Test
    void testDrawFromEmptyLibraryLoses() {
        assertTrue(alice.drawCard().isEmpty());

        SbaResult result = checker.check(game);

        assertEquals(List.of(alice), result.losers());
    }

    @Test
    void testSecondCheckDoesNothing() {
        Permanent bears = onBattlefield(game, alice, card(db, "Grizzly Bears"));
        bears.dealDamage(3, false);
        bob.loseLife(25);

        assertTrue(checker.check(game).changedAnything());
        SbaResult second = checker.check(game);

        assertSame(SbaResult.NONE, second);
        assertFalse(second.changedAnything());
    }
}
