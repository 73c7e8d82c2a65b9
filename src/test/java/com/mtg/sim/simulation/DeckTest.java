package com.mtg.sim.simulation;

import com.mtg.sim.GameFixtures;
import com.mtg.sim.card.Card;
import com.mtg.sim.card.CardDatabase;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Deck.
 */
class DeckTest {

    private static CardDatabase db;

    @BeforeAll
    static void loadCards() throws Exception {
        db = GameFixtures.testDatabase();
    }

    private static long count(Deck deck, String name) {
        return deck.getCards().stream().filter(c -> c.getName().equals(name)).count();
    }

    @Test
    void testEntryFormats() throws Exception {
        Deck deck = Deck.parse("4 Forest\n3x Mountain\nLightning Bolt\n2x Grizzly Bears (M10) 183\n",
                "test", db);

        assertEquals(10, deck.size());
        assertEquals(4, count(deck, "Forest"));
        assertEquals(3, count(deck, "Mountain"));
        assertEquals(1, count(deck, "Lightning Bolt"));
        assertEquals(2, count(deck, "Grizzly Bears"));
        assertEquals("test", deck.getName());
    }

    @Test
    void testHeadersCommentsAndSideboard() throws Exception {
        String text = String.join("\n",
                "About",
                "Name Blue Tempo",
                "",
                "# main deck",
                "Deck",
                "10 Island",
                "// spells",
                "4 Counterspell",
                "Sideboard",
                "2 Divination");

        Deck deck = Deck.parse(text, "fallback", db);

        assertEquals("Blue Tempo", deck.getName());
        assertEquals(14, deck.size());
        assertEquals(2, deck.getSideboard().size());
        assertEquals("Divination", deck.getSideboard().get(0).getName());
        assertEquals("Blue Tempo (14 cards)", deck.toString());
    }

    @Test
    void testUnknownCardReportsLine() {
        Deck.DeckException e = assertThrows(Deck.DeckException.class,
                () -> Deck.parse("4 Forest\n2 Black Lotus\n", "test", db));
        assertTrue(e.getMessage().contains("line 2"), e.getMessage());
        assertTrue(e.getMessage().contains("Black Lotus"));
    }

    @Test
    void testZeroCountRejected() {
        assertThrows(Deck.DeckException.class, () -> Deck.parse("0 Forest\n", "test", db));
    }

    @Test
    void testEmptyMainDeckRejected() {
        assertThrows(Deck.DeckException.class, () -> Deck.parse("# nothing\n", "test", db));
        assertThrows(Deck.DeckException.class, () -> Deck.parse("Sideboard\n2 Forest\n", "test", db));
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path green = Path.of(getClass().getResource("/decks/green.txt").toURI());
        Path red = Path.of(getClass().getResource("/decks/red.txt").toURI());

        Deck greenDeck = Deck.loadFromFile(green.toString(), db);
        Deck redDeck = Deck.loadFromFile(red.toString(), db);

        assertEquals("Green Stompy", greenDeck.getName());
        assertEquals(30, greenDeck.size());
        assertEquals(2, greenDeck.getSideboard().size());
        assertEquals("red", redDeck.getName());
        assertEquals(30, redDeck.size());
        assertTrue(redDeck.getSideboard().isEmpty());
    }

    @Test
    void testMissingFile() {
        assertThrows(Deck.DeckException.class, () -> Deck.loadFromFile("does/not/exist.txt", db));
    }

    @Test
    void testCardsAreCopies() throws Exception {
        Deck deck = Deck.parse("2 Forest\n", "test", db);
        deck.getCards().clear();
        assertEquals(2, deck.size());
        Card forest = deck.getCards().get(0);
        assertTrue(forest.isLand());
    }
}
