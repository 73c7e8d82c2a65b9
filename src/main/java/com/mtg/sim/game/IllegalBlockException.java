package com.mtg.sim.game;

/**
 * A block declaration breaks the blocking rules.
 */
public class IllegalBlockException extends GameRuleException {
    public IllegalBlockException(String message) {
        super(message);
    }
}
