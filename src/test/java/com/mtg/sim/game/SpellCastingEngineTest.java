package com.mtg.sim.game;

import com.mtg.sim.GameFixtures;
import com.mtg.sim.ability.Ability;
import com.mtg.sim.ability.Target;
import com.mtg.sim.card.Card;
import com.mtg.sim.card.CardDatabase;
import com.mtg.sim.card.ManaType;
import com.mtg.sim.game.zones.Permanent;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mtg.sim.GameFixtures.card;
import static com.mtg.sim.GameFixtures.onBattlefield;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SpellCastingEngine.
 */
class SpellCastingEngineTest {

    private static CardDatabase db;

    private Game game;
    private SpellCastingEngine engine;
    private Player alice;
    private Player bob;

    @BeforeAll
    static void loadCards() throws Exception {
        db = GameFixtures.testDatabase();
    }

    @BeforeEach
    void setUp() {
        game = GameFixtures.newGame(db);
        engine = game.getSpellCastingEngine();
        alice = game.getPlayer(0);
        bob = game.getPlayer(1);
        game.enterStep(alice, Step.MAIN1);
    }

    private Card inHand(Player player, String name) {
        Card card = card(db, name);
        player.getHand().add(card);
        return card;
    }

    private void passAround() {
        assertEquals(PassOutcome.PRIORITY_PASSED, engine.passPriority(game.getPlayer(
                game.getPriorityManager().getHolderSeat())));
        assertEquals(PassOutcome.RESOLVE_TOP, engine.passPriority(game.getPlayer(
                game.getPriorityManager().getHolderSeat())));
    }

    @Test
    void testCastCreatureResolvesOntoBattlefield() throws Exception {
        Card bears = inHand(alice, "Grizzly Bears");
        alice.getManaPool().add(ManaType.GREEN, 2);

        engine.castSpell(bears, alice, List.of());

        assertEquals(1, game.getStack().size());
        assertTrue(alice.getHand().isEmpty());
        assertTrue(alice.getManaPool().isEmpty());
        assertTrue(game.getPriorityManager().holdsPriority(alice.getSeat()));

        passAround();

        assertTrue(game.getStack().isEmpty());
        List<Permanent> creatures = alice.getBattlefield().getCreatures();
        assertEquals(1, creatures.size());
        assertEquals("Grizzly Bears", creatures.get(0).getName());
        assertTrue(creatures.get(0).isSummoningSick());
    }

    @Test
    void testStackResolvesLastInFirstOut() throws Exception {
        Card boltA = inHand(alice, "Lightning Bolt");
        Card boltC = inHand(alice, "Lightning Bolt");
        Card boltB = inHand(bob, "Lightning Bolt");
        alice.getManaPool().add(ManaType.RED, 2);
        bob.getManaPool().add(ManaType.RED, 1);

        engine.castSpell(boltA, alice, List.of(Target.player(bob.getSeat())));
        engine.passPriority(alice);
        engine.castSpell(boltB, bob, List.of(Target.player(alice.getSeat())));
        engine.castSpell(boltC, alice, List.of(Target.player(bob.getSeat())));
        assertEquals(3, game.getStack().size());

        engine.resolveTop();
        assertEquals(17, bob.getLife());
        assertEquals(20, alice.getLife());

        engine.resolveTop();
        assertEquals(17, alice.getLife());

        engine.resolveTop();
        assertEquals(14, bob.getLife());
        assertEquals(2, alice.getGraveyard().size());
        assertEquals(1, bob.getGraveyard().size());
    }

    @Test
    void testCounterspellCountersCreature() throws Exception {
        Card bears = inHand(alice, "Grizzly Bears");
        Card counterspell = inHand(bob, "Counterspell");
        alice.getManaPool().add(ManaType.GREEN, 2);
        bob.getManaPool().add(ManaType.BLUE, 2);

        StackItem.Spell bearsSpell = engine.castSpell(bears, alice, List.of());
        engine.passPriority(alice);
        engine.counterSpell(counterspell, bob, bearsSpell);
        assertFalse(bearsSpell.isCountered());

        assertEquals(PassOutcome.PRIORITY_PASSED, engine.passPriority(alice));
        assertFalse(bearsSpell.isCountered());
        assertEquals(PassOutcome.RESOLVE_TOP, engine.passPriority(bob));
        assertTrue(bearsSpell.isCountered());
        assertTrue(bob.getGraveyard().contains("Counterspell"));

        passAround();
        assertTrue(game.getStack().isEmpty());
        assertTrue(alice.getBattlefield().isEmpty());
        assertTrue(alice.getGraveyard().contains("Grizzly Bears"));
    }

    @Test
    void testCounteredCounterspellDoesNothing() throws Exception {
        Card bears = inHand(alice, "Grizzly Bears");
        Card aliceCounter = inHand(alice, "Counterspell");
        Card bobCounter = inHand(bob, "Counterspell");

        alice.getManaPool().add(ManaType.GREEN, 2);
        StackItem.Spell bearsSpell = engine.castSpell(bears, alice, List.of());
        engine.passPriority(alice);

        bob.getManaPool().add(ManaType.BLUE, 2);
        StackItem.Spell bobSpell = engine.counterSpell(bobCounter, bob, bearsSpell);

        alice.getManaPool().add(ManaType.BLUE, 2);
        engine.counterSpell(aliceCounter, alice, bobSpell);

        engine.resolveStack();

        assertTrue(bobSpell.isCountered());
        assertFalse(bearsSpell.isCountered());
        assertEquals(1, alice.getBattlefield().getCreatures().size());
        assertTrue(bob.getGraveyard().contains("Counterspell"));
        assertTrue(alice.getGraveyard().contains("Counterspell"));
    }

    @Test
    void testSorcerySpeedSpellOutsideMainPhase() {
        game.enterStep(alice, Step.BEGIN_COMBAT);
        Card bears = inHand(alice, "Grizzly Bears");
        Card divination = inHand(alice, "Divination");
        alice.getManaPool().add(ManaType.BLUE, 3);

        assertThrows(IllegalTimingException.class, () -> engine.castSpell(bears, alice, List.of()));
        assertThrows(IllegalTimingException.class, () -> engine.castSpell(divination, alice, List.of()));
        assertEquals(2, alice.getHand().size());
        assertEquals(3, alice.getManaPool().total());
        assertTrue(game.getStack().isEmpty());
    }

    @Test
    void testSorcerySpeedSpellWithNonEmptyStack() throws Exception {
        Card bolt = inHand(alice, "Lightning Bolt");
        Card bears = inHand(alice, "Grizzly Bears");
        alice.getManaPool().add(ManaType.RED, 1);
        alice.getManaPool().add(ManaType.GREEN, 2);

        engine.castSpell(bolt, alice, List.of(Target.player(bob.getSeat())));

        assertThrows(IllegalTimingException.class, () -> engine.castSpell(bears, alice, List.of()));
    }

    @Test
    void testInstantOnOpponentsTurn() throws Exception {
        game.enterStep(alice, Step.END);
        engine.passPriority(alice);
        Card bolt = inHand(bob, "Lightning Bolt");
        Card bears = inHand(bob, "Grizzly Bears");
        bob.getManaPool().add(ManaType.RED, 1);
        bob.getManaPool().add(ManaType.GREEN, 2);

        assertThrows(IllegalTimingException.class, () -> engine.castSpell(bears, bob, List.of()));
        engine.castSpell(bolt, bob, List.of(Target.player(alice.getSeat())));
        assertTrue(game.getPriorityManager().holdsPriority(alice.getSeat()));

        passAround();
        assertEquals(17, alice.getLife());
    }

    @Test
    void testActivePlayerRegainsPriorityAfterOpponentCasts() throws Exception {
        Card bolt = inHand(bob, "Lightning Bolt");
        bob.getManaPool().add(ManaType.RED, 1);
        engine.passPriority(alice);
        assertTrue(game.getPriorityManager().holdsPriority(bob.getSeat()));

        engine.castSpell(bolt, bob, List.of(Target.player(alice.getSeat())));

        assertEquals(alice.getSeat(), game.getPriorityManager().getHolderSeat());
        assertEquals(0, game.getPriorityManager().getConsecutivePasses());
        Card secondBolt = inHand(bob, "Lightning Bolt");
        bob.getManaPool().add(ManaType.RED, 1);
        assertThrows(IllegalTimingException.class,
                () -> engine.castSpell(secondBolt, bob, List.of(Target.player(alice.getSeat()))));

        assertEquals(PassOutcome.PRIORITY_PASSED, engine.passPriority(alice));
        assertEquals(PassOutcome.RESOLVE_TOP, engine.passPriority(bob));
        assertEquals(17, alice.getLife());
    }

    @Test
    void testInsufficientManaLeavesStateUnchanged() {
        Card giant = inHand(alice, "Hill Giant");
        alice.getManaPool().add(ManaType.RED, 1);
        alice.getManaPool().add(ManaType.GREEN, 1);

        assertThrows(InsufficientManaException.class, () -> engine.castSpell(giant, alice, List.of()));

        assertTrue(alice.getHand().contains(giant));
        assertTrue(game.getStack().isEmpty());
        assertEquals(2, alice.getManaPool().total());
    }

    @Test
    void testCastWithoutPriority() {
        Card bolt = inHand(bob, "Lightning Bolt");
        bob.getManaPool().add(ManaType.RED, 1);

        assertThrows(IllegalTimingException.class,
                () -> engine.castSpell(bolt, bob, List.of(Target.player(alice.getSeat()))));
    }

    @Test
    void testMissingTargetRejected() {
        Card bolt = inHand(alice, "Lightning Bolt");
        alice.getManaPool().add(ManaType.RED, 1);

        assertThrows(TargetInvalidException.class, () -> engine.castSpell(bolt, alice, List.of()));
        assertEquals(1, alice.getManaPool().total());
    }

    @Test
    void testSpellWithVanishedTargetFizzles() throws Exception {
        Permanent bears = onBattlefield(game, bob, card(db, "Grizzly Bears"));
        Card bolt = inHand(alice, "Lightning Bolt");
        alice.getManaPool().add(ManaType.RED, 1);

        engine.castSpell(bolt, alice, List.of(Target.permanent(bears.getId())));
        assertTrue(game.destroy(bears));

        engine.resolveTop();

        assertEquals(20, bob.getLife());
        assertTrue(alice.getGraveyard().contains("Lightning Bolt"));
    }

    @Test
    void testTapAbilityNeedsSourceFreeOfSummoningSickness() throws Exception {
        Permanent pyromancer = game.putOntoBattlefield(card(db, "Prodigal Pyromancer"), alice);
        Ability ability = pyromancer.getAbilities().get(0);
        List<Target> targets = List.of(Target.player(bob.getSeat()));

        assertThrows(CostUnpayableException.class,
                () -> engine.activateAbility(pyromancer, ability, alice, targets));
        assertFalse(pyromancer.isTapped());

        pyromancer.setSummoningSick(false);
        engine.activateAbility(pyromancer, ability, alice, targets);
        assertTrue(pyromancer.isTapped());
        assertEquals(1, game.getStack().size());

        engine.resolveTop();
        assertEquals(19, bob.getLife());

        assertThrows(CostUnpayableException.class,
                () -> engine.activateAbility(pyromancer, ability, alice, targets));
    }

    @Test
    void testManaAbilityIgnoresSummoningSickness() throws Exception {
        Permanent elves = game.putOntoBattlefield(card(db, "Llanowar Elves"), alice);
        assertTrue(elves.isSummoningSick());

        engine.activateManaAbility(elves, elves.getManaAbilities().get(0), alice, null);

        assertEquals(1, alice.getManaPool().get(ManaType.GREEN));
        assertTrue(elves.isTapped());
        assertTrue(game.getStack().isEmpty());
    }

    @Test
    void testAnyColorManaProducesRequestedColor() throws Exception {
        Permanent birds = onBattlefield(game, alice, card(db, "Birds of Paradise"));

        engine.activateAbility(birds, birds.getManaAbilities().get(0), alice, List.of());

        assertEquals(1, alice.getManaPool().total());
        birds.untap();
        alice.getManaPool().clear();

        engine.activateManaAbility(birds, birds.getManaAbilities().get(0), alice, ManaType.BLUE);
        assertEquals(1, alice.getManaPool().get(ManaType.BLUE));
    }

    @Test
    void testEntersTheBattlefieldTrigger() throws Exception {
        Card firecaller = inHand(alice, "Shivan Firecaller");
        alice.getManaPool().add(ManaType.RED, 3);

        engine.castSpell(firecaller, alice, List.of());
        passAround();

        assertEquals(1, alice.getBattlefield().getCreatures().size());
        assertEquals(1, game.getStack().size());

        passAround();
        assertEquals(18, bob.getLife());
        assertTrue(game.getStack().isEmpty());
    }

    @Test
    void testDiesTrigger() throws Exception {
        Permanent imp = onBattlefield(game, alice, card(db, "Gravedigger Imp"));
        game.enterStep(bob, Step.MAIN1);
        Card bolt = inHand(bob, "Lightning Bolt");
        bob.getManaPool().add(ManaType.RED, 1);

        engine.castSpell(bolt, bob, List.of(Target.permanent(imp.getId())));
        passAround();

        assertTrue(alice.getBattlefield().isEmpty());
        assertTrue(alice.getGraveyard().contains("Gravedigger Imp"));
        assertEquals(1, game.getStack().size());

        passAround();
        assertEquals(22, alice.getLife());
    }
}
