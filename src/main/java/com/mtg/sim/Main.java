package com.mtg.sim;

import ch.qos.logback.classic.Level;
import com.mtg.sim.ability.AbilityParser;
import com.mtg.sim.ability.OracleTextAbilityParser;
import com.mtg.sim.card.CardDatabase;
import com.mtg.sim.card.CardDatabaseException;
import com.mtg.sim.game.GameConfig;
import com.mtg.sim.simulation.Deck;
import com.mtg.sim.simulation.MatchupResults;
import com.mtg.sim.simulation.SimulationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * MTG simulator CLI - Main entry point.
 */
@Command(name = "mtg-sim",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Two-player MTG game simulator",
        subcommands = {
                Main.RunCommand.class,
                Main.MatchupCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    /**
     * Options shared by every subcommand.
     */
    static class CommonOptions {
        @Option(names = {"-n", "--num-games"}, defaultValue = "100",
                description = "Number of games to simulate")
        int numGames;

        @Option(names = {"-c", "--cards"}, defaultValue = "cards.json",
                description = "Path to cards database")
        String cardsPath;

        @Option(names = {"-s", "--seed"},
                description = "Base random seed (optional)")
        Long seed;

        @Option(names = {"--max-turns"}, defaultValue = "50",
                description = "Turn budget per game before it ends without a result")
        int maxTurns;

        @Option(names = {"--log-level"}, defaultValue = "INFO",
                description = "Log level: TRACE, DEBUG, INFO, WARN or ERROR")
        String logLevel;

        void applyLogLevel() {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            Level level = Level.toLevel(logLevel, Level.INFO);
            root.setLevel(level);
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.mtg.sim")).setLevel(level);
        }

        long baseSeed() {
            return seed != null ? seed : System.nanoTime();
        }

        GameConfig config() {
            return GameConfig.DEFAULT.withMaxTurns(maxTurns);
        }

        CardDatabase loadCards() throws CardDatabaseException {
            CardDatabase db = CardDatabase.fromFile(cardsPath);
            System.err.println("✓ Loaded " + db.cardCount() + " cards from " + cardsPath);
            return db;
        }
    }

    // ========== RUN COMMAND ==========
    @Command(name = "run", description = "Play random pairings of the decks in a directory")
    static class RunCommand implements Callable<Integer> {
        @Mixin
        CommonOptions common;

        @Option(names = {"-d", "--decks"}, defaultValue = "decks",
                description = "Directory of deck files")
        String deckDir;

        @Override
        public Integer call() {
            common.applyLogLevel();
            CardDatabase db;
            try {
                db = common.loadCards();
            } catch (CardDatabaseException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return 1;
            }

            List<Deck> decks;
            try {
                decks = SimulationEngine.loadDecks(Path.of(deckDir), db);
            } catch (Deck.DeckException e) {
                System.err.println("✗ Failed to load decks from '" + deckDir + "': " + e.getMessage());
                return 1;
            }
            if (decks.size() < 2) {
                System.err.println("✗ Need at least two decks in '" + deckDir + "', found " + decks.size());
                return 1;
            }

            long baseSeed = common.baseSeed();
            System.out.println("\n=== MTG Simulator ===\n");
            System.out.println("Decks: " + decks.size() + " from " + deckDir);
            System.out.println("Games: " + common.numGames);
            System.out.println("Seed: " + baseSeed);
            System.out.println();

            AbilityParser parser = new OracleTextAbilityParser();
            long startTime = System.currentTimeMillis();
            MatchupResults results = SimulationEngine.runRandomPairings(
                    decks, common.numGames, baseSeed, db, parser, common.config());
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(results, elapsed);
            return 0;
        }
    }

    // ========== MATCHUP COMMAND ==========
    @Command(name = "matchup", description = "Play two decks head to head")
    static class MatchupCommand implements Callable<Integer> {
        @Mixin
        CommonOptions common;

        @Parameters(index = "0", description = "First deck file")
        String deck1Path;

        @Parameters(index = "1", description = "Second deck file")
        String deck2Path;

        @Override
        public Integer call() {
            common.applyLogLevel();
            CardDatabase db;
            try {
                db = common.loadCards();
            } catch (CardDatabaseException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return 1;
            }

            Deck deck1;
            Deck deck2;
            try {
                deck1 = Deck.loadFromFile(deck1Path, db);
                deck2 = Deck.loadFromFile(deck2Path, db);
            } catch (Deck.DeckException e) {
                System.err.println("✗ Failed to parse deck file: " + e.getMessage());
                return 1;
            }

            long baseSeed = common.baseSeed();
            System.out.println("\n=== MTG Deck Matchup ===\n");
            System.out.println("Deck 1: " + deck1);
            System.out.println("Deck 2: " + deck2);
            System.out.println("Games: " + common.numGames);
            System.out.println("Seed: " + baseSeed);
            System.out.println();

            AbilityParser parser = new OracleTextAbilityParser();
            long startTime = System.currentTimeMillis();
            MatchupResults results = SimulationEngine.runMatchup(
                    deck1, deck2, common.numGames, baseSeed, db, parser, common.config());
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(results, elapsed);
            return 0;
        }
    }

    private static void printResults(MatchupResults results, long elapsedMillis) {
        System.out.println("=== Results ===");
        System.out.print(results.formatReport());
        double seconds = Math.max(elapsedMillis, 1) / 1000.0;
        System.out.printf("Simulated %d games in %.2fs: %.0f games/sec%n",
                results.getGames() + results.getFailedGames(), seconds,
                (results.getGames() + results.getFailedGames()) / seconds);
    }
}
