package com.mtg.sim.game;

/**
 * An attack declaration breaks the attacking rules.
 */
public class IllegalAttackException extends GameRuleException {
    public IllegalAttackException(String message) {
        super(message);
    }
}
