package com.mtg.sim.game;

/**
 * An activation or casting cost cannot be paid.
 */
public class CostUnpayableException extends GameRuleException {
    public CostUnpayableException(String message) {
        super(message);
    }
}
