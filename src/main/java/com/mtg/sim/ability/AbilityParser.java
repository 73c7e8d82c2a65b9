package com.mtg.sim.ability;

import com.mtg.sim.card.Card;

import java.util.List;

/**
 * Turns a card's rules text into structured abilities and spell effects.
 * Implementations must be stateless so one parser can serve parallel games.
 */
public interface AbilityParser {

    /**
     * Abilities of a permanent (activated, triggered, static and mana).
     */
    List<Ability> parseAbilities(Card card);

    /**
     * Effects an instant or sorcery applies when it resolves.
     */
    List<Effect> parseSpellEffects(Card card);
}
