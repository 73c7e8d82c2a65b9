package com.mtg.sim.game.zones;

public class Exile extends OrderedZone {
}
