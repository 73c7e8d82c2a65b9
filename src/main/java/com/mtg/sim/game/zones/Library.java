package com.mtg.sim.game.zones;

import com.mtg.sim.card.Card;
import com.mtg.sim.rng.GameRng;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * A player's library, top card first. Drawing from an empty library is not an
 * error here; the caller records it so state-based actions can end the game.
 */
public class Library {
    private final Deque<Card> cards;

    public Library(List<Card> deck) {
        this.cards = new ArrayDeque<>(deck);
    }

    /**
     * Remove the top card, or return empty when nothing is left.
     */
    public Optional<Card> draw() {
        return Optional.ofNullable(cards.pollFirst());
    }

    public void shuffle(GameRng rng) {
        List<Card> order = new ArrayList<>(cards);
        rng.shuffle(order);
        cards.clear();
        cards.addAll(order);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }
}
