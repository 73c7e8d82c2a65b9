package com.mtg.sim.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Categories of mana a pool can hold or a cost can demand.
 * ANY is mana from an "any color" source; it only pays generic costs.
 */
public enum ManaType {
    WHITE('W', ColorFlags.WHITE),
    BLUE('U', ColorFlags.BLUE),
    BLACK('B', ColorFlags.BLACK),
    RED('R', ColorFlags.RED),
    GREEN('G', ColorFlags.GREEN),
    COLORLESS('C', 0),
    ANY('A', 0);

    private final char symbol;
    private final int flag;

    ManaType(char symbol, int flag) {
        this.symbol = symbol;
        this.flag = flag;
    }

    @JsonValue
    public char getSymbol() {
        return symbol;
    }

    /**
     * Bit flag in {@link ColorFlags}, 0 for the non-color categories.
     */
    public int getFlag() {
        return flag;
    }

    public boolean isColor() {
        return flag != 0;
    }

    /**
     * Parse a mana symbol (W/U/B/R/G/C, case-insensitive).
     * @throws IllegalArgumentException if the character is not a mana symbol
     */
    public static ManaType fromChar(char c) {
        return switch (Character.toUpperCase(c)) {
            case 'W' -> WHITE;
            case 'U' -> BLUE;
            case 'B' -> BLACK;
            case 'R' -> RED;
            case 'G' -> GREEN;
            case 'C' -> COLORLESS;
            default -> throw new IllegalArgumentException("Invalid mana symbol: " + c);
        };
    }

    /**
     * Parse a color name as it appears in rules text ("red", "Green").
     * @return the color, or null if the word is not a color
     */
    public static ManaType fromColorName(String name) {
        if (name == null) {
            return null;
        }
        return switch (name.trim().toLowerCase()) {
            case "white" -> WHITE;
            case "blue" -> BLUE;
            case "black" -> BLACK;
            case "red" -> RED;
            case "green" -> GREEN;
            default -> null;
        };
    }
}
