package com.mtg.sim.game.zones;

import com.mtg.sim.card.Card;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Hand - cards in hand.
 */
public class Hand {
    private final List<Card> cards = new ArrayList<>();

    public void add(Card card) {
        cards.add(card);
    }

    public void addAll(List<Card> cardsToAdd) {
        cards.addAll(cardsToAdd);
    }

    /**
     * Remove one copy of a card (by identity).
     * @return true if the card was in hand
     */
    public boolean remove(Card card) {
        for (int i = 0; i < cards.size(); i++) {
            if (cards.get(i) == card) {
                cards.remove(i);
                return true;
            }
        }
        return false;
    }

    public boolean contains(Card card) {
        for (Card c : cards) {
            if (c == card) {
                return true;
            }
        }
        return false;
    }

    public Optional<Card> findByName(String name) {
        return cards.stream()
                .filter(c -> c.getName().equals(name))
                .findFirst();
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public List<Card> getCards() {
        return List.copyOf(cards);
    }
}
