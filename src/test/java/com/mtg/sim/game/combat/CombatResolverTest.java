package com.mtg.sim.game.combat;

import com.mtg.sim.GameFixtures;
import com.mtg.sim.card.CardDatabase;
import com.mtg.sim.game.Game;
import com.mtg.sim.game.IllegalAttackException;
import com.mtg.sim.game.IllegalBlockException;
import com.mtg.sim.game.Player;
import com.mtg.sim.game.Step;
import com.mtg.sim.game.zones.Permanent;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.mtg.sim.GameFixtures.artifactCreature;
import static com.mtg.sim.GameFixtures.card;
import static com.mtg.sim.GameFixtures.creature;
import static com.mtg.sim.GameFixtures.onBattlefield;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CombatResolver.
 */
class CombatResolverTest {

    private static CardDatabase db;

    private Game game;
    private CombatResolver combat;
    private Player alice;
    private Player bob;

    @BeforeAll
    static void loadCards() throws Exception {
        db = GameFixtures.testDatabase();
    }

    @BeforeEach
    void setUp() {
        game = GameFixtures.newGame(db);
        combat = game.getCombatResolver();
        alice = game.getPlayer(0);
        bob = game.getPlayer(1);
        game.enterStep(alice, Step.DECLARE_ATTACKERS);
    }

    private Permanent aliceCreature(String name, int power, int toughness, String... keywords) {
        return onBattlefield(game, alice, creature(name, "{1}{G}", power, toughness, keywords));
    }

    private Permanent bobCreature(String name, int power, int toughness, String... keywords) {
        return onBattlefield(game, bob, creature(name, "{1}{G}", power, toughness, keywords));
    }

    private void attackAndBlock(Permanent attacker, Permanent... blockers) throws Exception {
        combat.declareAttackers(alice, List.of(attacker), bob);
        List<CombatResolver.Block> blocks = new ArrayList<>();
        for (Permanent blocker : blockers) {
            blocks.add(new CombatResolver.Block(blocker, attacker));
        }
        combat.declareBlockers(bob, blocks);
    }

    // ---- Evasion ----

    @Test
    void testFlyingNeedsFlyingOrReach() {
        Permanent flyer = aliceCreature("Flyer", 2, 2, "Flying");
        assertFalse(combat.canBlock(flyer, bobCreature("Ground", 2, 2)));
        assertTrue(combat.canBlock(flyer, bobCreature("Spider", 1, 3, "Reach")));
        assertTrue(combat.canBlock(flyer, bobCreature("Bird", 1, 1, "Flying")));
    }

    @Test
    void testIntimidateNeedsArtifactOrSharedColor() {
        Permanent attacker = onBattlefield(game, alice, creature("Intimidator", "{1}{R}", 2, 2, "Intimidate"));
        Permanent red = onBattlefield(game, bob, creature("Red", "{R}", 1, 1));
        Permanent green = bobCreature("Green", 1, 1);
        assertTrue(combat.canBlock(attacker, red));
        assertFalse(combat.canBlock(attacker, green));
        assertTrue(combat.canBlock(attacker, onBattlefield(game, bob, artifactCreature("Golem", 3, 3))));
    }

    @Test
    void testFearNeedsArtifactOrBlack() {
        Permanent attacker = aliceCreature("Fearsome", 2, 2, "Fear");
        assertFalse(combat.canBlock(attacker, bobCreature("Green", 1, 1)));
        assertTrue(combat.canBlock(attacker, onBattlefield(game, bob, creature("Black", "{B}", 1, 1))));
        assertTrue(combat.canBlock(attacker, onBattlefield(game, bob, artifactCreature("Golem", 3, 3))));
    }

    @Test
    void testShadowOnlyBlocksShadow() {
        Permanent shadow = aliceCreature("Shade", 2, 2, "Shadow");
        Permanent plain = aliceCreature("Plain", 2, 2);
        Permanent bobShadow = bobCreature("Other Shade", 1, 1, "Shadow");
        Permanent bobPlain = bobCreature("Wall", 0, 4);

        assertTrue(combat.canBlock(shadow, bobShadow));
        assertFalse(combat.canBlock(shadow, bobPlain));
        assertFalse(combat.canBlock(plain, bobShadow));
        assertTrue(combat.canBlock(plain, bobPlain));
    }

    @Test
    void testHorsemanship() {
        Permanent rider = aliceCreature("Rider", 2, 2, "Horsemanship");
        assertFalse(combat.canBlock(rider, bobCreature("Footman", 2, 2)));
        assertTrue(combat.canBlock(rider, bobCreature("Cavalry", 2, 2, "Horsemanship")));
    }

    @Test
    void testTappedCreatureCannotBlock() {
        Permanent attacker = aliceCreature("Attacker", 2, 2);
        Permanent blocker = bobCreature("Blocker", 2, 2);
        blocker.tap();
        assertFalse(combat.canBlock(attacker, blocker));
    }

    @Test
    void testProtectionPreventsBlock() {
        Permanent knight = onBattlefield(game, alice, card(db, "White Knight"));
        Permanent black = onBattlefield(game, bob, creature("Black Bear", "{1}{B}", 2, 2));
        Permanent green = bobCreature("Green Bear", 2, 2);

        assertFalse(combat.canBlock(knight, black));
        assertTrue(combat.canBlock(knight, green));
    }

    // ---- Declarations ----

    @Test
    void testSummoningSickCannotAttack() {
        Permanent fresh = game.putOntoBattlefield(creature("Fresh", "{1}{G}", 2, 2), alice);
        assertFalse(combat.canAttack(fresh));
        assertThrows(IllegalAttackException.class, () -> combat.declareAttackers(alice, List.of(fresh), bob));
        assertFalse(fresh.isTapped());
    }

    @Test
    void testHasteAttacksImmediately() throws Exception {
        Permanent hasty = game.putOntoBattlefield(creature("Hasty", "{R}", 2, 1, "Haste"), alice);
        combat.declareAttackers(alice, List.of(hasty), bob);
        assertTrue(hasty.isAttacking());
        assertTrue(hasty.isTapped());
    }

    @Test
    void testVigilanceDoesNotTap() throws Exception {
        Permanent angel = onBattlefield(game, alice, card(db, "Serra Angel"));
        combat.declareAttackers(alice, List.of(angel), bob);
        assertTrue(angel.isAttacking());
        assertFalse(angel.isTapped());
    }

    @Test
    void testDefenderCannotAttack() {
        Permanent wall = aliceCreature("Wall", 0, 5, "Defender");
        assertFalse(combat.canAttack(wall));
        assertThrows(IllegalAttackException.class, () -> combat.declareAttackers(alice, List.of(wall), bob));
    }

    @Test
    void testGoadedCreatureMustAttack() throws Exception {
        Permanent goaded = aliceCreature("Goaded", 2, 2);
        Permanent other = aliceCreature("Other", 2, 2);
        goaded.goad(bob.getSeat());

        assertEquals(List.of(goaded), combat.getRequiredAttackers(alice));
        assertThrows(IllegalAttackException.class, () -> combat.declareAttackers(alice, List.of(other), bob));
        assertFalse(other.isAttacking());

        combat.declareAttackers(alice, List.of(goaded), bob);
        assertTrue(goaded.isAttacking());
    }

    @Test
    void testCannotAttackWithOpponentsCreature() {
        Permanent theirs = bobCreature("Theirs", 2, 2);
        assertThrows(IllegalAttackException.class, () -> combat.declareAttackers(alice, List.of(theirs), bob));
    }

    @Test
    void testMenaceNeedsTwoBlockers() throws Exception {
        Permanent menace = aliceCreature("Menacer", 3, 3, "Menace");
        Permanent first = bobCreature("First", 1, 1);
        Permanent second = bobCreature("Second", 1, 1);
        combat.declareAttackers(alice, List.of(menace), bob);

        assertThrows(IllegalBlockException.class,
                () -> combat.declareBlockers(bob, List.of(new CombatResolver.Block(first, menace))));
        assertFalse(first.isBlocking());

        combat.declareBlockers(bob, List.of(new CombatResolver.Block(first, menace),
                new CombatResolver.Block(second, menace)));
        assertEquals(2, menace.getBlockedByIds().size());
    }

    @Test
    void testBlockerCannotBlockTwice() throws Exception {
        Permanent a = aliceCreature("A", 2, 2);
        Permanent b = aliceCreature("B", 2, 2);
        Permanent blocker = bobCreature("Blocker", 2, 2);
        combat.declareAttackers(alice, List.of(a, b), bob);

        assertThrows(IllegalBlockException.class, () -> combat.declareBlockers(bob, List.of(
                new CombatResolver.Block(blocker, a), new CombatResolver.Block(blocker, b))));
    }

    // ---- Damage ----

    @Test
    void testFirstStrikeKillsBlockerBeforeItDealsDamage() throws Exception {
        Permanent striker = aliceCreature("Striker", 3, 3, "First strike");
        Permanent blocker = bobCreature("Blocker", 2, 2);
        attackAndBlock(striker, blocker);

        List<CombatDamageStep> steps = combat.resolveCombatDamage();

        assertEquals(List.of(CombatDamageStep.FIRST_STRIKE_DAMAGE, CombatDamageStep.CLEANUP_1,
                CombatDamageStep.REGULAR_DAMAGE, CombatDamageStep.CLEANUP_2, CombatDamageStep.DONE), steps);
        assertFalse(bob.getBattlefield().contains(blocker.getId()));
        assertEquals(0, striker.getDamage());
        assertEquals(20, bob.getLife());
    }

    @Test
    void testUnblockedLifelink() throws Exception {
        Permanent vampire = aliceCreature("Vampire", 3, 3, "Lifelink");
        combat.declareAttackers(alice, List.of(vampire), bob);

        combat.resolveCombatDamage();

        assertEquals(17, bob.getLife());
        assertEquals(23, alice.getLife());
    }

    @Test
    void testTrampleAssignsExcessToPlayer() throws Exception {
        Permanent trampler = aliceCreature("Trampler", 5, 5, "Trample");
        Permanent blocker = bobCreature("Blocker", 2, 2);
        attackAndBlock(trampler, blocker);

        combat.resolveCombatDamage();

        assertEquals(17, bob.getLife());
        assertTrue(bob.getBattlefield().isEmpty());
    }

    @Test
    void testBlockedWithoutTrampleDealsNoPlayerDamage() throws Exception {
        Permanent attacker = aliceCreature("Big", 5, 5);
        Permanent blocker = bobCreature("Blocker", 2, 2);
        attackAndBlock(attacker, blocker);

        combat.resolveCombatDamage();

        assertEquals(20, bob.getLife());
        assertEquals(2, attacker.getDamage());
    }

    @Test
    void testDoubleStrikeDealsDamageTwice() throws Exception {
        Permanent striker = aliceCreature("Double", 2, 2, "Double strike");
        combat.declareAttackers(alice, List.of(striker), bob);

        combat.resolveCombatDamage();

        assertEquals(16, bob.getLife());
    }

    @Test
    void testDeathtouchBlockerTrades() throws Exception {
        Permanent attacker = aliceCreature("Giant", 4, 4);
        Permanent snake = bobCreature("Snake", 1, 1, "Deathtouch");
        attackAndBlock(attacker, snake);

        combat.resolveCombatDamage();

        assertTrue(alice.getBattlefield().isEmpty());
        assertTrue(bob.getBattlefield().isEmpty());
    }

    @Test
    void testIndestructibleBlockerSurvives() throws Exception {
        Permanent attacker = aliceCreature("Giant", 3, 3);
        Permanent myr = onBattlefield(game, bob, card(db, "Darksteel Myr"));
        attackAndBlock(attacker, myr);

        combat.resolveCombatDamage();

        assertTrue(bob.getBattlefield().contains(myr.getId()));
        assertEquals(3, myr.getDamage());
    }

    @Test
    void testLethalDamageToPlayerEndsCombatEarly() throws Exception {
        bob.loseLife(18);
        Permanent striker = aliceCreature("Striker", 2, 2, "First strike");
        combat.declareAttackers(alice, List.of(striker), bob);

        List<CombatDamageStep> steps = combat.resolveCombatDamage();

        assertEquals(List.of(CombatDamageStep.FIRST_STRIKE_DAMAGE, CombatDamageStep.CLEANUP_1,
                CombatDamageStep.DONE), steps);
        assertTrue(bob.hasLost());
    }

    @Test
    void testEndCombatClearsState() throws Exception {
        Permanent attacker = aliceCreature("Attacker", 1, 1);
        Permanent blocker = bobCreature("Blocker", 0, 4);
        attackAndBlock(attacker, blocker);

        combat.endCombat();

        assertFalse(attacker.isAttacking());
        assertFalse(blocker.isBlocking());
        assertTrue(attacker.getBlockedByIds().isEmpty());
        assertTrue(combat.getAttackers().isEmpty());
    }
}
