package com.mtg.sim.rng;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;

/**
 * Seeded Mulberry32 generator. Every game owns one, so a batch run is reproducible
 * from its base seed no matter how games are scheduled across threads.
 */
public class GameRng {
    private static final long GOLDEN_GAMMA = 0x9E3779B9L;

    private final long seed;
    private long state;

    /**
     * Create a generator from the lower 32 bits of the seed.
     */
    public GameRng(long seed) {
        this.seed = seed;
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Create a generator with a random seed.
     */
    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * Derive the seed of the n-th game of a batch started from a base seed.
     */
    public static long gameSeed(long baseSeed, int gameIndex) {
        return baseSeed + GOLDEN_GAMMA * (gameIndex + 1L);
    }

    /**
     * Next value in [0, 1).
     */
    public double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;
        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;
        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;
        return result / 4294967296.0;
    }

    /**
     * Random integer in [0, bound).
     * @throws IllegalArgumentException if bound is not positive
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) (next() * bound);
    }

    public boolean coinFlip() {
        return next() < 0.5;
    }

    /**
     * Fisher-Yates shuffle in place.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = nextInt(i + 1);
            Collections.swap(list, i, j);
        }
    }

    /**
     * Pick a random element.
     * @throws IllegalArgumentException if the list is empty
     */
    public <T> T pick(List<T> list) {
        if (list.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return list.get(nextInt(list.size()));
    }

    public long getSeed() {
        return seed;
    }
}
