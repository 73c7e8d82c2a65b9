package com.mtg.sim.simulation;

import com.mtg.sim.card.Card;
import com.mtg.sim.card.CardDatabase;
import com.mtg.sim.card.CardDatabaseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A main deck and sideboard resolved against the card database.
 */
public class Deck {
    // "4x Elvish Mystic (CMM) 284", "4 Elvish Mystic", "Elvish Mystic"
    private static final Pattern ENTRY = Pattern.compile("^(?:(\\d+)x?\\s+)?(.+?)(?:\\s+\\([A-Za-z0-9]+\\)(?:\\s+\\S+)?)?$");

    private final List<Card> cards;
    private final List<Card> sideboard;
    private final String name;

    public Deck(List<Card> cards, String name) {
        this(cards, List.of(), name);
    }

    public Deck(List<Card> cards, List<Card> sideboard, String name) {
        this.cards = new ArrayList<>(cards);
        this.sideboard = new ArrayList<>(sideboard);
        this.name = name;
    }

    /**
     * Load a deck from a file. The deck is named after an "About / Name X" header
     * if present, otherwise after the file name without its .txt extension.
     *
     * @param path Path to the deck file
     * @param db   Card database
     * @return Parsed deck
     * @throws DeckException if the file cannot be read or parsing fails
     */
    public static Deck loadFromFile(String path, CardDatabase db) throws DeckException {
        String content;
        try {
            content = Files.readString(Path.of(path));
        } catch (IOException e) {
            throw new DeckException("Failed to read deck file: " + path, e);
        }
        String fileName = Path.of(path).getFileName().toString();
        String defaultName = fileName.endsWith(".txt")
                ? fileName.substring(0, fileName.length() - 4)
                : fileName;
        return parse(content, defaultName, db);
    }

    /**
     * Parse deck list text.
     * Supports "COUNTx NAME (SET) NUMBER", "COUNT NAME" and bare "NAME" lines, a "Deck"
     * header, a "Sideboard" section, and comments starting with # or //.
     *
     * @throws DeckException on a malformed line or a card missing from the database
     */
    public static Deck parse(String content, String defaultName, CardDatabase db) throws DeckException {
        List<Card> main = new ArrayList<>();
        List<Card> side = new ArrayList<>();
        String deckName = defaultName;
        boolean inSideboard = false;

        String[] lines = content.split("\\R");
        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum].trim();

            // Skip empty lines and comments
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
                continue;
            }
            if (line.equalsIgnoreCase("About")) {
                if (lineNum + 1 < lines.length && lines[lineNum + 1].trim().startsWith("Name ")) {
                    deckName = lines[lineNum + 1].trim().substring("Name ".length()).trim();
                    lineNum++;
                }
                continue;
            }
            if (line.equalsIgnoreCase("Deck")) {
                inSideboard = false;
                continue;
            }
            if (line.equalsIgnoreCase("Sideboard")) {
                inSideboard = true;
                continue;
            }

            Matcher m = ENTRY.matcher(line);
            if (!m.matches()) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1) + ": " + line);
            }
            int count = m.group(1) == null ? 1 : Integer.parseInt(m.group(1));
            if (count <= 0) {
                throw new DeckException("Invalid card count at line " + (lineNum + 1) + ": " + count);
            }
            String cardName = m.group(2).trim();

            Card card;
            try {
                card = db.getCard(cardName);
            } catch (CardDatabaseException e) {
                throw new DeckException("Card not found at line " + (lineNum + 1) + ": " + cardName, e);
            }
            List<Card> target = inSideboard ? side : main;
            for (int i = 0; i < count; i++) {
                target.add(card);
            }
        }

        if (main.isEmpty()) {
            throw new DeckException("Deck '" + deckName + "' has no main deck cards");
        }
        return new Deck(main, side, deckName);
    }

    public List<Card> getCards() {
        return new ArrayList<>(cards);
    }

    public List<Card> getSideboard() {
        return new ArrayList<>(sideboard);
    }

    public int size() {
        return cards.size();
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name + " (" + cards.size() + " cards)";
    }

    /**
     * Exception thrown when deck parsing fails.
     */
    public static class DeckException extends Exception {
        public DeckException(String message) {
            super(message);
        }

        public DeckException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
