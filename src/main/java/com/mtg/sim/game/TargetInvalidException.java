package com.mtg.sim.game;

/**
 * A required target is missing or illegal when a spell is cast or an ability activated.
 */
public class TargetInvalidException extends GameRuleException {
    public TargetInvalidException(String message) {
        super(message);
    }
}
