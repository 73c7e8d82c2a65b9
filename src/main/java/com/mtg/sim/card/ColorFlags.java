package com.mtg.sim.card;

import java.util.List;

/**
 * Bitflag set of the five colors, used for color identity checks in combat and targeting.
 */
public final class ColorFlags {
    public static final int WHITE = 1 << 0;
    public static final int BLUE = 1 << 1;
    public static final int BLACK = 1 << 2;
    public static final int RED = 1 << 3;
    public static final int GREEN = 1 << 4;

    public static final ColorFlags COLORLESS = new ColorFlags(0);

    private final int flags;

    public ColorFlags(int flags) {
        this.flags = flags;
    }

    /**
     * Build from Scryfall color letters ("R", "G").
     */
    public static ColorFlags fromSymbols(List<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            return COLORLESS;
        }
        int flags = 0;
        for (String symbol : symbols) {
            if (symbol == null || symbol.isEmpty()) {
                continue;
            }
            ManaType type = ManaType.fromChar(symbol.charAt(0));
            flags |= type.getFlag();
        }
        return new ColorFlags(flags);
    }

    public static ColorFlags of(ManaType... colors) {
        int flags = 0;
        for (ManaType color : colors) {
            flags |= color.getFlag();
        }
        return new ColorFlags(flags);
    }

    public boolean contains(ManaType color) {
        return color.isColor() && (flags & color.getFlag()) != 0;
    }

    /**
     * True if the two sets have at least one color in common.
     */
    public boolean sharesColorWith(ColorFlags other) {
        return (flags & other.flags) != 0;
    }

    public boolean isColorless() {
        return flags == 0;
    }

    public int count() {
        return Integer.bitCount(flags);
    }

    public int getFlags() {
        return flags;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ColorFlags other && other.flags == flags;
    }

    @Override
    public int hashCode() {
        return flags;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (ManaType type : ManaType.values()) {
            if (contains(type)) {
                sb.append(type.getSymbol());
            }
        }
        return sb.isEmpty() ? "C" : sb.toString();
    }
}
