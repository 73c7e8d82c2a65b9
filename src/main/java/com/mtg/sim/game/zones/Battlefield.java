package com.mtg.sim.game.zones;

import com.mtg.sim.card.CardType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One player's permanents, indexed by id. The per-kind lists are views computed
 * from the same collection, so removal by id keeps all of them consistent.
 */
public class Battlefield {
    private final Map<Long, Permanent> permanents = new LinkedHashMap<>();

    public void add(Permanent permanent) {
        permanents.put(permanent.getId(), permanent);
    }

    /**
     * Remove a permanent by id.
     * @return the removed permanent, or empty if it was not here
     */
    public Optional<Permanent> remove(long id) {
        return Optional.ofNullable(permanents.remove(id));
    }

    public Optional<Permanent> find(long id) {
        return Optional.ofNullable(permanents.get(id));
    }

    public boolean contains(long id) {
        return permanents.containsKey(id);
    }

    /**
     * Snapshot of all permanents in the order they entered.
     */
    public List<Permanent> getAll() {
        return List.copyOf(permanents.values());
    }

    public List<Permanent> getCreatures() {
        return filter(CardType.CREATURE);
    }

    public List<Permanent> getLands() {
        return filter(CardType.LAND);
    }

    public List<Permanent> getArtifacts() {
        return filter(CardType.ARTIFACT);
    }

    public List<Permanent> getEnchantments() {
        return filter(CardType.ENCHANTMENT);
    }

    public List<Permanent> getPlaneswalkers() {
        return filter(CardType.PLANESWALKER);
    }

    public List<Permanent> getUntappedLands() {
        List<Permanent> lands = new ArrayList<>(8);
        for (Permanent p : permanents.values()) {
            if (p.isLand() && !p.isTapped()) {
                lands.add(p);
            }
        }
        return lands;
    }

    /**
     * Untapped permanents with at least one mana ability.
     */
    public List<Permanent> getAvailableManaSources() {
        List<Permanent> sources = new ArrayList<>(8);
        for (Permanent p : permanents.values()) {
            if (!p.isTapped() && p.isManaProducer()) {
                sources.add(p);
            }
        }
        return sources;
    }

    private List<Permanent> filter(CardType type) {
        List<Permanent> result = new ArrayList<>(8);
        for (Permanent p : permanents.values()) {
            if (p.getCard().hasType(type)) {
                result.add(p);
            }
        }
        return result;
    }

    public int countByName(String name) {
        int count = 0;
        for (Permanent p : permanents.values()) {
            if (p.getName().equals(name)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Untap step: untap everything and let creatures that started the turn here attack.
     */
    public void untapAll() {
        for (Permanent p : permanents.values()) {
            p.untap();
            p.setSummoningSick(false);
        }
    }

    public int size() {
        return permanents.size();
    }

    public boolean isEmpty() {
        return permanents.isEmpty();
    }
}
