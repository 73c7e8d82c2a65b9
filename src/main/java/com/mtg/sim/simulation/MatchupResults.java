package com.mtg.sim.simulation;

import com.mtg.sim.game.GameResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Win/loss tally per deck over a batch of games.
 */
public class MatchupResults {
    private final Map<String, DeckRecord> records = new TreeMap<>();
    private int games;
    private int decidedGames;
    private int decidedTurns;
    private int failedGames;

    /**
     * Count one finished game.
     */
    public void record(GameResult result) {
        games++;
        switch (result.outcome()) {
            case WIN -> {
                recordFor(result.winner()).wins++;
                recordFor(result.loser()).losses++;
                decidedGames++;
                decidedTurns += result.turns();
            }
            case DRAW -> {
                for (String player : result.players()) {
                    recordFor(player).draws++;
                }
            }
            case NO_RESULT -> {
                for (String player : result.players()) {
                    recordFor(player).noResults++;
                }
            }
        }
    }

    /**
     * Count a game that ended with an error instead of a result.
     */
    public void recordFailure() {
        failedGames++;
    }

    private DeckRecord recordFor(String deckName) {
        return records.computeIfAbsent(deckName, DeckRecord::new);
    }

    public Optional<DeckRecord> get(String deckName) {
        return Optional.ofNullable(records.get(deckName));
    }

    /**
     * Decks ordered by win percentage, then wins, then name.
     */
    public List<DeckRecord> getRanking() {
        List<DeckRecord> ranking = new ArrayList<>(records.values());
        ranking.sort(Comparator.comparingDouble(DeckRecord::winPercentage).reversed()
                .thenComparing(Comparator.comparingInt(DeckRecord::getWins).reversed())
                .thenComparing(DeckRecord::getName));
        return ranking;
    }

    public int getGames() {
        return games;
    }

    public int getFailedGames() {
        return failedGames;
    }

    /**
     * Average length of games that produced a winner, or 0 if none did.
     */
    public double getAverageWinTurn() {
        return decidedGames == 0 ? 0.0 : (double) decidedTurns / decidedGames;
    }

    public String formatReport() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s %6s %6s %6s %6s %7s%n", "Deck", "Wins", "Losses", "Draws", "NoRes", "Win %"));
        for (DeckRecord record : getRanking()) {
            sb.append(String.format("%-30s %6d %6d %6d %6d %6.1f%%%n",
                    record.getName(), record.getWins(), record.getLosses(),
                    record.getDraws(), record.getNoResults(), record.winPercentage()));
        }
        sb.append(String.format("%nGames: %d, average winning turn: %.2f", games, getAverageWinTurn()));
        if (failedGames > 0) {
            sb.append(String.format(", failed: %d", failedGames));
        }
        sb.append(System.lineSeparator());
        return sb.toString();
    }

    /**
     * Results of a single deck.
     */
    public static final class DeckRecord {
        private final String name;
        private int wins;
        private int losses;
        private int draws;
        private int noResults;

        DeckRecord(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public int getWins() {
            return wins;
        }

        public int getLosses() {
            return losses;
        }

        public int getDraws() {
            return draws;
        }

        public int getNoResults() {
            return noResults;
        }

        public int getGames() {
            return wins + losses + draws + noResults;
        }

        /**
         * Wins as a percentage of all games played, 0 when none were played.
         */
        public double winPercentage() {
            int total = getGames();
            return total == 0 ? 0.0 : 100.0 * wins / total;
        }
    }
}
