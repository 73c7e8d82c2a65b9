package com.mtg.sim.game.zones;

import com.mtg.sim.card.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * A face-up zone that keeps cards in the order they arrived, most recent last.
 */
public abstract class OrderedZone {
    private final List<Card> cards = new ArrayList<>();

    public void add(Card card) {
        cards.add(card);
    }

    public boolean contains(String cardName) {
        for (Card card : cards) {
            if (card.getName().equals(cardName)) {
                return true;
            }
        }
        return false;
    }

    public int countByName(String cardName) {
        int count = 0;
        for (Card card : cards) {
            if (card.getName().equals(cardName)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Snapshot in arrival order.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }
}
