package com.mtg.sim.game;

/**
 * Per-game settings.
 *
 * @param startingLife      life total each player starts with
 * @param openingHandSize   cards drawn before the first turn
 * @param maxHandSize       hand size enforced in the cleanup step
 * @param maxTurns          turn budget; exceeding it ends the game with no result
 * @param maxActionsPerStep bound on priority actions in one step
 */
public record GameConfig(int startingLife, int openingHandSize, int maxHandSize, int maxTurns,
                         int maxActionsPerStep) {

    public static final GameConfig DEFAULT = new GameConfig(20, 7, 7, 50, 200);

    public GameConfig {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be at least 1: " + maxTurns);
        }
        if (maxActionsPerStep < 1) {
            throw new IllegalArgumentException("maxActionsPerStep must be at least 1: " + maxActionsPerStep);
        }
        if (openingHandSize < 0 || maxHandSize < 0) {
            throw new IllegalArgumentException("Hand sizes cannot be negative");
        }
    }

    public GameConfig withMaxTurns(int maxTurns) {
        return new GameConfig(startingLife, openingHandSize, maxHandSize, maxTurns, maxActionsPerStep);
    }

    public GameConfig withStartingLife(int startingLife) {
        return new GameConfig(startingLife, openingHandSize, maxHandSize, maxTurns, maxActionsPerStep);
    }

    public GameConfig withOpeningHandSize(int openingHandSize) {
        return new GameConfig(startingLife, openingHandSize, maxHandSize, maxTurns, maxActionsPerStep);
    }
}
