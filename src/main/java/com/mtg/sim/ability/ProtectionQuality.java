package com.mtg.sim.ability;

import com.mtg.sim.card.ManaType;

/**
 * Qualities a permanent can have protection from.
 */
public enum ProtectionQuality {
    WHITE(ManaType.WHITE),
    BLUE(ManaType.BLUE),
    BLACK(ManaType.BLACK),
    RED(ManaType.RED),
    GREEN(ManaType.GREEN),
    ARTIFACTS(null);

    private final ManaType color;

    ProtectionQuality(ManaType color) {
        this.color = color;
    }

    /**
     * The color this quality names, or null for ARTIFACTS.
     */
    public ManaType getColor() {
        return color;
    }

    /**
     * Parse the word after "protection from" ("red", "artifacts").
     * @return the quality, or null if not modeled
     */
    public static ProtectionQuality fromText(String text) {
        if (text == null) {
            return null;
        }
        String word = text.trim().toLowerCase();
        if (word.equals("artifacts") || word.equals("artifact")) {
            return ARTIFACTS;
        }
        ManaType color = ManaType.fromColorName(word);
        if (color == null) {
            return null;
        }
        return valueOf(color.name());
    }
}
