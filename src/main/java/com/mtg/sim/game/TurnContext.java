package com.mtg.sim.game;

/**
 * The turn being played, handed to each step.
 */
public record TurnContext(int turnNumber, Player activePlayer, Player defendingPlayer, boolean firstTurnOfGame) {
}
