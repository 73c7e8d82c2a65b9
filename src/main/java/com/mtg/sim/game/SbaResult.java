package com.mtg.sim.game;

import com.mtg.sim.game.zones.Permanent;

import java.util.List;

/**
 * What one state-based action check did.
 */
public record SbaResult(List<Permanent> died, List<Player> losers) {
    public static final SbaResult NONE = new SbaResult(List.of(), List.of());

    public SbaResult {
        died = List.copyOf(died);
        losers = List.copyOf(losers);
    }

    public boolean changedAnything() {
        return !died.isEmpty() || !losers.isEmpty();
    }
}
