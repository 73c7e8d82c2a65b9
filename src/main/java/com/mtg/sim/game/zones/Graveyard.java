package com.mtg.sim.game.zones;

/**
 * Dead creatures, destroyed permanents, discards, countered and resolved spells.
 */
public class Graveyard extends OrderedZone {
}
