package com.mtg.sim.card;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Card database keyed by card name, loaded from a JSON array of cards.
 * Read-only after loading, so one instance is safely shared by parallel games.
 */
public class CardDatabase {
    private static final Logger log = LoggerFactory.getLogger(CardDatabase.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Card>> CARD_LIST = new TypeReference<>() {};

    private final Map<String, Card> cards;

    private CardDatabase(Map<String, Card> cards) {
        this.cards = cards;
    }

    /**
     * Load cards from a JSON file.
     */
    public static CardDatabase fromFile(String path) throws CardDatabaseException {
        try {
            String content = Files.readString(Path.of(path));
            CardDatabase db = fromJson(content);
            log.info("Loaded {} cards from {}", db.cardCount(), path);
            return db;
        } catch (IOException e) {
            throw new CardDatabaseException("IO error reading " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a classpath resource.
     */
    public static CardDatabase fromResource(String resourcePath) throws CardDatabaseException {
        try (InputStream is = CardDatabase.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardDatabaseException("Resource not found: " + resourcePath);
            }
            return fromCardList(MAPPER.readValue(is, CARD_LIST));
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a JSON string.
     */
    public static CardDatabase fromJson(String json) throws CardDatabaseException {
        try {
            return fromCardList(MAPPER.readValue(json, CARD_LIST));
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Build a database from cards already in memory.
     */
    public static CardDatabase fromCards(List<Card> cardList) {
        return fromCardList(cardList);
    }

    private static CardDatabase fromCardList(List<Card> cardList) {
        Map<String, Card> cards = new HashMap<>();
        for (Card card : cardList) {
            if (card.getName() == null) {
                log.debug("Skipping card entry without a name");
                continue;
            }
            // Reprints appear more than once; the first printing wins
            cards.putIfAbsent(card.getName(), card);
        }
        return new CardDatabase(Map.copyOf(cards));
    }

    /**
     * Look up a card by exact name.
     */
    public Optional<Card> getCardByName(String name) {
        return Optional.ofNullable(cards.get(name));
    }

    /**
     * Get a card by name.
     * @throws CardDatabaseException if the card is not found
     */
    public Card getCard(String name) throws CardDatabaseException {
        Card card = cards.get(name);
        if (card == null) {
            throw new CardDatabaseException("Card not found: " + name);
        }
        return card;
    }

    public int cardCount() {
        return cards.size();
    }

    public boolean hasCard(String name) {
        return cards.containsKey(name);
    }
}
