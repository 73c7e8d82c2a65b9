package com.mtg.sim.card;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CardDatabase.
 */
class CardDatabaseTest {

    private static CardDatabase db;

    @BeforeAll
    static void loadDatabase() throws CardDatabaseException {
        db = CardDatabase.fromResource("cards-test.json");
    }

    @Test
    void testLoadCards() {
        assertTrue(db.cardCount() > 0, "Should have loaded cards");
        assertTrue(db.hasCard("Forest"));
        assertFalse(db.hasCard("Black Lotus"));
    }

    @Test
    void testFirstPrintingWins() throws CardDatabaseException {
        Card bears = db.getCard("Grizzly Bears");
        assertEquals("", bears.getOracleText(), "Reprint entry should not replace the first printing");
    }

    @Test
    void testGetBasicLand() throws CardDatabaseException {
        Card card = db.getCard("Forest");
        assertTrue(card.isLand());
        assertFalse(card.isCreature());
        assertTrue(card.isPermanentCard());
        assertEquals(0, card.getManaValue());
        assertTrue(card.getColors().isColorless());
    }

    @Test
    void testGetCreatureCard() throws CardDatabaseException {
        Card card = db.getCard("Serra Angel");
        assertTrue(card.isCreature());
        assertEquals(5, card.getManaValue());
        assertEquals(4, card.getPowerValue());
        assertEquals(4, card.getToughnessValue());
        assertTrue(card.hasKeyword(Keyword.FLYING));
        assertTrue(card.hasKeyword(Keyword.VIGILANCE));
        assertTrue(card.getColors().contains(ManaType.WHITE));
    }

    @Test
    void testArtifactCreature() throws CardDatabaseException {
        Card card = db.getCard("Darksteel Myr");
        assertTrue(card.isArtifact());
        assertTrue(card.isCreature());
        assertTrue(card.hasKeyword(Keyword.INDESTRUCTIBLE));
        assertTrue(card.getColors().isColorless());
    }

    @Test
    void testUnknownKeywordsAreDropped() throws CardDatabaseException {
        Card card = db.getCard("White Knight");
        assertTrue(card.hasKeyword(Keyword.FIRST_STRIKE));
        assertEquals(1, card.getKeywords().size());
    }

    @Test
    void testInstantAndSorcery() throws CardDatabaseException {
        Card bolt = db.getCard("Lightning Bolt");
        assertTrue(bolt.isInstant());
        assertFalse(bolt.isPermanentCard());

        Card divination = db.getCard("Divination");
        assertTrue(divination.isSorcery());
        assertEquals(3, divination.getManaValue());
    }

    @Test
    void testCardNotFound() {
        assertThrows(CardDatabaseException.class, () -> db.getCard("Nonexistent Card"));
        assertTrue(db.getCardByName("Nonexistent Card").isEmpty());
    }

    @Test
    void testFromJsonSkipsNamelessEntries() throws CardDatabaseException {
        CardDatabase small = CardDatabase.fromJson(
                "[{\"name\": \"Shock\", \"mana_cost\": \"{R}\", \"type_line\": \"Instant\", \"extra\": 1},"
                        + " {\"mana_cost\": \"{1}\"}]");
        assertEquals(1, small.cardCount());
        assertEquals(1, small.getCard("Shock").getManaValue());
    }

    @Test
    void testInvalidJson() {
        assertThrows(CardDatabaseException.class, () -> CardDatabase.fromJson("not json"));
    }

    @Test
    void testMissingResource() {
        assertThrows(CardDatabaseException.class, () -> CardDatabase.fromResource("missing.json"));
    }
}
