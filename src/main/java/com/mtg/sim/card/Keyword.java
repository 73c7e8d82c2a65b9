package com.mtg.sim.card;

import java.util.Locale;

/**
 * Keyword abilities the engine knows how to apply.
 */
public enum Keyword {
    FLYING,
    REACH,
    INTIMIDATE,
    SHADOW,
    FEAR,
    MENACE,
    HORSEMANSHIP,
    FIRST_STRIKE,
    DOUBLE_STRIKE,
    TRAMPLE,
    LIFELINK,
    DEATHTOUCH,
    INDESTRUCTIBLE,
    HASTE,
    VIGILANCE,
    DEFENDER,
    FLASH,
    HEXPROOF,
    SHROUD;

    /**
     * Look up a keyword by its printed name ("First strike", "double-strike").
     * @return the keyword, or null if the engine does not model it
     */
    public static Keyword fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String normalized = name.trim()
                .toUpperCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
        for (Keyword keyword : values()) {
            if (keyword.name().equals(normalized)) {
                return keyword;
            }
        }
        return null;
    }

    public String getDisplayName() {
        String lower = name().toLowerCase(Locale.ROOT).replace('_', ' ');
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
