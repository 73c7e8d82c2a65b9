package com.mtg.sim.card;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable mana requirement: strict per-category amounts plus a generic amount
 * payable with mana of any category.
 */
public final class ManaCost {
    public static final ManaCost ZERO = new ManaCost(new EnumMap<>(ManaType.class), 0);

    private static final ManaType[] STRICT_ORDER = {
        ManaType.WHITE, ManaType.BLUE, ManaType.BLACK,
        ManaType.RED, ManaType.GREEN, ManaType.COLORLESS
    };

    private final Map<ManaType, Integer> strict;
    private final int generic;

    private ManaCost(Map<ManaType, Integer> strict, int generic) {
        this.strict = strict;
        this.generic = generic;
    }

    /**
     * Build a cost from explicit amounts.
     * @throws IllegalArgumentException for negative amounts or an ANY requirement
     */
    public static ManaCost of(Map<ManaType, Integer> strict, int generic) {
        if (generic < 0) {
            throw new IllegalArgumentException("Generic cost cannot be negative: " + generic);
        }
        EnumMap<ManaType, Integer> copy = new EnumMap<>(ManaType.class);
        for (Map.Entry<ManaType, Integer> entry : strict.entrySet()) {
            if (entry.getKey() == ManaType.ANY) {
                throw new IllegalArgumentException("A cost cannot demand ANY mana; use generic");
            }
            if (entry.getValue() < 0) {
                throw new IllegalArgumentException("Negative requirement for " + entry.getKey());
            }
            if (entry.getValue() > 0) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return new ManaCost(copy, generic);
    }

    public static ManaCost generic(int amount) {
        return of(Map.of(), amount);
    }

    /**
     * Parse a bracketed cost such as "{2}{R}{G}" with X counting as zero.
     */
    public static ManaCost parse(String costString) {
        return parse(costString, 0);
    }

    /**
     * Parse a bracketed cost such as "{X}{R}".
     * Hybrid and Phyrexian symbols count as their first color, "{2/W}" as 2 generic.
     *
     * @param costString the cost as printed on the card
     * @param x          the value already chosen for X
     * @throws IllegalArgumentException if a symbol is not recognized
     */
    public static ManaCost parse(String costString, int x) {
        if (costString == null || costString.isBlank()) {
            return ZERO;
        }

        EnumMap<ManaType, Integer> strict = new EnumMap<>(ManaType.class);
        int generic = 0;
        int pos = 0;
        String s = costString.trim();

        while (pos < s.length()) {
            char c = s.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (c != '{') {
                throw new IllegalArgumentException("Invalid mana cost '" + costString + "' at position " + pos);
            }
            int end = s.indexOf('}', pos);
            if (end == -1) {
                throw new IllegalArgumentException("Unclosed symbol in mana cost: " + costString);
            }
            String token = s.substring(pos + 1, end).trim().toUpperCase();
            pos = end + 1;

            if (token.isEmpty()) {
                throw new IllegalArgumentException("Empty symbol in mana cost: " + costString);
            }
            if (Character.isDigit(token.charAt(0)) && token.indexOf('/') == -1) {
                generic += Integer.parseInt(token);
                continue;
            }
            switch (token) {
                case "X", "Y", "Z" -> generic += x;
                case "S" -> generic += 1;
                default -> {
                    if (token.indexOf('/') != -1) {
                        String first = token.substring(0, token.indexOf('/'));
                        if (Character.isDigit(first.charAt(0))) {
                            generic += Integer.parseInt(first);
                        } else {
                            strict.merge(ManaType.fromChar(first.charAt(0)), 1, Integer::sum);
                        }
                    } else if (token.length() == 1) {
                        strict.merge(ManaType.fromChar(token.charAt(0)), 1, Integer::sum);
                    } else {
                        throw new IllegalArgumentException("Unknown mana symbol {" + token + "} in " + costString);
                    }
                }
            }
        }

        return new ManaCost(strict, generic);
    }

    /**
     * Strict requirement for a category; 0 for ANY.
     */
    public int get(ManaType type) {
        return strict.getOrDefault(type, 0);
    }

    public int getGeneric() {
        return generic;
    }

    /**
     * Total mana value (converted mana cost).
     */
    public int getManaValue() {
        int total = generic;
        for (int amount : strict.values()) {
            total += amount;
        }
        return total;
    }

    public boolean isZero() {
        return getManaValue() == 0;
    }

    public Map<ManaType, Integer> getStrictRequirements() {
        return Collections.unmodifiableMap(strict);
    }

    /**
     * Colors that appear in the strict requirements.
     */
    public ColorFlags getColors() {
        int flags = 0;
        for (ManaType type : strict.keySet()) {
            flags |= type.getFlag();
        }
        return new ColorFlags(flags);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ManaCost other)) return false;
        return generic == other.generic && strict.equals(other.strict);
    }

    @Override
    public int hashCode() {
        return 31 * strict.hashCode() + generic;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (generic > 0) {
            sb.append('{').append(generic).append('}');
        }
        for (ManaType type : STRICT_ORDER) {
            int amount = get(type);
            for (int i = 0; i < amount; i++) {
                sb.append('{').append(type.getSymbol()).append('}');
            }
        }
        return sb.isEmpty() ? "{0}" : sb.toString();
    }
}
