package com.mtg.sim.game;

/**
 * A spell or ability was used outside its legal window.
 */
public class IllegalTimingException extends GameRuleException {
    public IllegalTimingException(String message) {
        super(message);
    }
}
