package com.mtg.sim.game.zones;

import com.mtg.sim.card.Card;
import com.mtg.sim.card.CardType;

import java.util.Set;

/**
 * Primary kind of a permanent, picked by precedence from its card types.
 */
public enum PermanentKind {
    CREATURE,
    PLANESWALKER,
    LAND,
    ARTIFACT,
    ENCHANTMENT;

    /**
     * Kind for a card: the first of CREATURE, PLANESWALKER, LAND, ARTIFACT, ENCHANTMENT it has.
     * @throws IllegalArgumentException if the card cannot be a permanent
     */
    public static PermanentKind of(Card card) {
        Set<CardType> types = card.getTypes();
        if (types.contains(CardType.CREATURE)) return CREATURE;
        if (types.contains(CardType.PLANESWALKER)) return PLANESWALKER;
        if (types.contains(CardType.LAND)) return LAND;
        if (types.contains(CardType.ARTIFACT)) return ARTIFACT;
        if (types.contains(CardType.ENCHANTMENT)) return ENCHANTMENT;
        throw new IllegalArgumentException(card.getName() + " is not a permanent card");
    }
}
