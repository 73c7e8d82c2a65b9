package com.mtg.sim.game;

/**
 * A game action was rejected by the rules. Nothing was changed by the rejected action.
 */
public class GameRuleException extends Exception {
    public GameRuleException(String message) {
        super(message);
    }
}
