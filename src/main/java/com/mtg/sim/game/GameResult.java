package com.mtg.sim.game;

import java.util.List;

/**
 * Outcome of one game. Winner and loser are null unless the outcome is WIN.
 */
public record GameResult(String winner, String loser, int turns, Outcome outcome, List<String> players) {

    public enum Outcome {
        WIN,
        /** All remaining players lost at the same time. */
        DRAW,
        /** The turn budget ran out. */
        NO_RESULT
    }

    public GameResult {
        players = List.copyOf(players);
    }

    public static GameResult win(String winner, String loser, int turns, List<String> players) {
        return new GameResult(winner, loser, turns, Outcome.WIN, players);
    }

    public static GameResult draw(int turns, List<String> players) {
        return new GameResult(null, null, turns, Outcome.DRAW, players);
    }

    public static GameResult noResult(int turns, List<String> players) {
        return new GameResult(null, null, turns, Outcome.NO_RESULT, players);
    }

    public boolean hasWinner() {
        return outcome == Outcome.WIN;
    }
}
