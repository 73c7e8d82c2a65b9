package com.mtg.sim.game;

import com.mtg.sim.card.ManaCost;
import com.mtg.sim.card.ManaType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Mana pool holding a count per mana category. Counts never go negative.
 */
public class ManaPool {
    // Colorless first so colored mana stays available for later colored costs
    private static final ManaType[] GENERIC_PAYMENT_ORDER = {
        ManaType.COLORLESS, ManaType.WHITE, ManaType.BLUE,
        ManaType.BLACK, ManaType.RED, ManaType.GREEN, ManaType.ANY
    };

    private final EnumMap<ManaType, Integer> mana = new EnumMap<>(ManaType.class);

    public ManaPool() {
    }

    private ManaPool(EnumMap<ManaType, Integer> mana) {
        this.mana.putAll(mana);
    }

    /**
     * Add mana of one category.
     * @throws IllegalArgumentException if amount is negative
     */
    public void add(ManaType type, int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Cannot add negative mana: " + amount + " " + type);
        }
        if (amount > 0) {
            mana.merge(type, amount, Integer::sum);
        }
    }

    public int get(ManaType type) {
        return mana.getOrDefault(type, 0);
    }

    public int total() {
        int total = 0;
        for (int amount : mana.values()) {
            total += amount;
        }
        return total;
    }

    public boolean isEmpty() {
        return total() == 0;
    }

    public void clear() {
        mana.clear();
    }

    public ManaPool copy() {
        return new ManaPool(mana);
    }

    /**
     * Check whether the cost can be paid. Strict requirements are checked per
     * category, then whatever remains in every category must cover the generic part.
     */
    public boolean canPay(ManaCost cost) {
        int reserved = 0;
        for (Map.Entry<ManaType, Integer> requirement : cost.getStrictRequirements().entrySet()) {
            if (get(requirement.getKey()) < requirement.getValue()) {
                return false;
            }
            reserved += requirement.getValue();
        }
        return total() - reserved >= cost.getGeneric();
    }

    /**
     * Pay a cost. Strict requirements come out of their own category; generic is
     * taken in {@link #GENERIC_PAYMENT_ORDER}.
     *
     * @throws InsufficientManaException if the pool cannot cover the cost; the pool is left untouched
     */
    public void pay(ManaCost cost) throws InsufficientManaException {
        if (!canPay(cost)) {
            throw new InsufficientManaException(cost, this);
        }

        for (Map.Entry<ManaType, Integer> requirement : cost.getStrictRequirements().entrySet()) {
            deduct(requirement.getKey(), requirement.getValue());
        }

        int genericRemaining = cost.getGeneric();
        for (ManaType type : GENERIC_PAYMENT_ORDER) {
            if (genericRemaining == 0) break;
            int toPay = Math.min(get(type), genericRemaining);
            deduct(type, toPay);
            genericRemaining -= toPay;
        }
    }

    private void deduct(ManaType type, int amount) {
        int remaining = get(type) - amount;
        if (remaining == 0) {
            mana.remove(type);
        } else {
            mana.put(type, remaining);
        }
    }

    @Override
    public String toString() {
        if (mana.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{");
        for (Map.Entry<ManaType, Integer> entry : mana.entrySet()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(entry.getKey().getSymbol()).append(':').append(entry.getValue());
        }
        return sb.append('}').toString();
    }
}
