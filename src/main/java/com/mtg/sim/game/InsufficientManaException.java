package com.mtg.sim.game;

import com.mtg.sim.card.ManaCost;

/**
 * The mana pool cannot cover a cost.
 */
public class InsufficientManaException extends CostUnpayableException {
    private final transient ManaCost cost;

    public InsufficientManaException(ManaCost cost, ManaPool pool) {
        super("Cannot pay " + cost + " from pool " + pool);
        this.cost = cost;
    }

    public ManaCost getCost() {
        return cost;
    }
}
