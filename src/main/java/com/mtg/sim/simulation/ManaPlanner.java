package com.mtg.sim.simulation;

import com.mtg.sim.ability.Ability;
import com.mtg.sim.card.ManaCost;
import com.mtg.sim.card.ManaType;
import com.mtg.sim.game.CostUnpayableException;
import com.mtg.sim.game.Game;
import com.mtg.sim.game.ManaPool;
import com.mtg.sim.game.Player;
import com.mtg.sim.game.zones.Permanent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Plans which mana abilities to activate for a cost, tapping the sources that
 * produce the fewest types first so flexible sources stay available.
 */
public final class ManaPlanner {

    private ManaPlanner() {
        // Utility class - prevent instantiation
    }

    /**
     * One mana ability activation with the type asked for.
     */
    public record Activation(Permanent source, Ability.Mana ability, ManaType requested) {
    }

    /**
     * Work out activations that, added to the current pool, pay the cost.
     *
     * @return the activations, possibly empty if the pool already covers the cost,
     *         or empty Optional if the cost cannot be paid
     */
    public static Optional<List<Activation>> plan(Player player, ManaCost cost) {
        ManaPool simulated = player.getManaPool().copy();
        if (simulated.canPay(cost)) {
            return Optional.of(List.of());
        }

        List<Permanent> sources = new ArrayList<>();
        for (Permanent permanent : player.getBattlefield().getAvailableManaSources()) {
            if (firstFreeAbility(permanent) != null) {
                sources.add(permanent);
            }
        }
        // Least flexible sources first, so any-color sources stay free for colored costs
        sources.sort(Comparator.comparingInt(ManaPlanner::flexibility)
                .thenComparingLong(Permanent::getId));

        List<Activation> plan = new ArrayList<>();
        Set<Long> used = new HashSet<>();

        // Colored and colorless requirements first
        for (Map.Entry<ManaType, Integer> requirement : cost.getStrictRequirements().entrySet()) {
            ManaType type = requirement.getKey();
            while (simulated.get(type) < requirement.getValue()) {
                Permanent source = findSource(sources, used, type);
                if (source == null) {
                    return Optional.empty();
                }
                addActivation(plan, used, simulated, source, type);
            }
        }

        // Generic with whatever is left
        while (!simulated.canPay(cost)) {
            Permanent source = findSource(sources, used, null);
            if (source == null) {
                return Optional.empty();
            }
            addActivation(plan, used, simulated, source, null);
        }
        return Optional.of(plan);
    }

    /**
     * Whether the player could pay the cost with their pool and untapped sources.
     */
    public static boolean canAfford(Player player, ManaCost cost) {
        return plan(player, cost).isPresent();
    }

    /**
     * Activate mana abilities until the player's pool can pay the cost.
     *
     * @return false if no plan exists; nothing is activated in that case
     * @throws CostUnpayableException if an activation is rejected
     */
    public static boolean produce(Game game, Player player, ManaCost cost) throws CostUnpayableException {
        Optional<List<Activation>> plan = plan(player, cost);
        if (plan.isEmpty()) {
            return false;
        }
        activate(game, player, plan.get());
        return true;
    }

    /**
     * Carry out planned activations in order.
     */
    public static void activate(Game game, Player player, List<Activation> plan) throws CostUnpayableException {
        for (Activation activation : plan) {
            game.getSpellCastingEngine().activateManaAbility(
                    activation.source(), activation.ability(), player, activation.requested());
        }
    }

    /**
     * Mana in the pool plus what untapped sources could add, regardless of type.
     */
    public static int availableMana(Player player) {
        int total = player.getManaPool().total();
        for (Permanent permanent : player.getBattlefield().getAvailableManaSources()) {
            Ability.Mana ability = firstFreeAbility(permanent);
            if (ability != null) {
                total += ability.production().amount();
            }
        }
        return total;
    }

    private static Permanent findSource(List<Permanent> sources, Set<Long> used, ManaType type) {
        for (Permanent source : sources) {
            if (used.contains(source.getId())) {
                continue;
            }
            if (type == null || producesType(firstFreeAbility(source), type)) {
                return source;
            }
        }
        return null;
    }

    private static void addActivation(List<Activation> plan, Set<Long> used, ManaPool simulated,
                                      Permanent source, ManaType requested) {
        Ability.Mana ability = firstFreeAbility(source);
        used.add(source.getId());
        plan.add(new Activation(source, ability, requested));
        simulated.add(ability.production().produce(requested), ability.production().amount());
    }

    private static int flexibility(Permanent source) {
        Set<ManaType> types = source.getProducedTypes();
        return types.contains(ManaType.ANY) ? 5 : types.size();
    }

    private static boolean producesType(Ability.Mana ability, ManaType type) {
        List<ManaType> options = ability.production().options();
        return options.contains(type) || (type.isColor() && options.contains(ManaType.ANY));
    }

    /**
     * First mana ability whose only cost is tapping, usable right now.
     */
    private static Ability.Mana firstFreeAbility(Permanent permanent) {
        for (Ability.Mana ability : permanent.getManaAbilities()) {
            boolean free = ability.cost().mana().isZero() && ability.cost().life() == 0;
            boolean tapOk = !ability.cost().tap() || !permanent.isTapped();
            if (free && tapOk) {
                return ability;
            }
        }
        return null;
    }
}
