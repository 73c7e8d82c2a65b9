package com.mtg.sim.simulation;

import com.mtg.sim.ability.AbilityParser;
import com.mtg.sim.card.CardDatabase;
import com.mtg.sim.game.Game;
import com.mtg.sim.game.GameConfig;
import com.mtg.sim.game.GameResult;
import com.mtg.sim.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Runs games between decks, one isolated {@link Game} per run, in parallel for batches.
 */
public final class SimulationEngine {
    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    private SimulationEngine() {
        // Utility class - prevent instantiation
    }

    /**
     * Run a complete game between two decks.
     * @param seed Random seed for reproducibility
     * @return The game result
     */
    public static GameResult runGame(Deck deckA, Deck deckB, long seed, CardDatabase db,
                                     AbilityParser parser, GameConfig config) {
        Game game = new Game(db, parser, config, new GameRng(seed));
        game.addPlayer(deckA);
        game.addPlayer(deckB);
        return game.start();
    }

    /**
     * Play games between randomly chosen pairs of different decks.
     *
     * @throws IllegalArgumentException if fewer than two decks are given
     */
    public static MatchupResults runRandomPairings(List<Deck> decks, int numGames, long baseSeed,
                                                   CardDatabase db, AbilityParser parser, GameConfig config) {
        if (decks.size() < 2) {
            throw new IllegalArgumentException("Need at least two decks, got " + decks.size());
        }
        log.info("Simulating {} games across {} decks", numGames, decks.size());
        List<Optional<GameResult>> results = IntStream.range(0, numGames)
                .parallel()
                .mapToObj(i -> {
                    long seed = GameRng.gameSeed(baseSeed, i);
                    GameRng pairing = new GameRng(seed);
                    Deck first = pairing.pick(decks);
                    Deck second = pairing.pick(decks);
                    while (second == first) {
                        second = pairing.pick(decks);
                    }
                    return runSafely(first, second, seed, i, db, parser, config);
                })
                .collect(Collectors.toList());
        return tally(results);
    }

    /**
     * Play two decks against each other repeatedly.
     */
    public static MatchupResults runMatchup(Deck deckA, Deck deckB, int numGames, long baseSeed,
                                            CardDatabase db, AbilityParser parser, GameConfig config) {
        log.info("Simulating {} games: {} vs {}", numGames, deckA.getName(), deckB.getName());
        List<Optional<GameResult>> results = IntStream.range(0, numGames)
                .parallel()
                .mapToObj(i -> runSafely(deckA, deckB, GameRng.gameSeed(baseSeed, i), i, db, parser, config))
                .collect(Collectors.toList());
        return tally(results);
    }

    private static Optional<GameResult> runSafely(Deck deckA, Deck deckB, long seed, int index,
                                                  CardDatabase db, AbilityParser parser, GameConfig config) {
        try {
            return Optional.of(runGame(deckA, deckB, seed, db, parser, config));
        } catch (RuntimeException e) {
            log.warn("Game {} ({} vs {}, seed {}) failed", index, deckA.getName(), deckB.getName(), seed, e);
            return Optional.empty();
        }
    }

    private static MatchupResults tally(List<Optional<GameResult>> results) {
        MatchupResults tally = new MatchupResults();
        for (Optional<GameResult> result : results) {
            if (result.isPresent()) {
                tally.record(result.get());
            } else {
                tally.recordFailure();
            }
        }
        return tally;
    }

    /**
     * Load every *.txt deck file in a directory, sorted by file name.
     *
     * @throws Deck.DeckException if the directory cannot be listed or a deck fails to parse
     */
    public static List<Deck> loadDecks(Path directory, CardDatabase db) throws Deck.DeckException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(p -> p.getFileName().toString().endsWith(".txt"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new Deck.DeckException("Failed to list deck directory: " + directory, e);
        }
        List<Deck> decks = new ArrayList<>(files.size());
        for (Path file : files) {
            decks.add(Deck.loadFromFile(file.toString(), db));
        }
        log.info("Loaded {} decks from {}", decks.size(), directory);
        return decks;
    }
}
