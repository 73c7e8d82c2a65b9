package com.mtg.sim.card;

/**
 * Card types recognized on a type line.
 */
public enum CardType {
    LAND("Land"),
    CREATURE("Creature"),
    ARTIFACT("Artifact"),
    ENCHANTMENT("Enchantment"),
    PLANESWALKER("Planeswalker"),
    INSTANT("Instant"),
    SORCERY("Sorcery");

    private final String displayName;

    CardType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse a single type word, ignoring case.
     * @return the type, or null for supertypes, subtypes and unknown words
     */
    public static CardType fromWord(String word) {
        if (word == null) {
            return null;
        }
        return switch (word.trim().toLowerCase()) {
            case "land" -> LAND;
            case "creature" -> CREATURE;
            case "artifact" -> ARTIFACT;
            case "enchantment" -> ENCHANTMENT;
            case "planeswalker" -> PLANESWALKER;
            case "instant" -> INSTANT;
            case "sorcery" -> SORCERY;
            default -> null;
        };
    }
}
