package com.mtg.sim.game;

import com.mtg.sim.ability.Effect;
import com.mtg.sim.ability.EffectDuration;
import com.mtg.sim.ability.Target;
import com.mtg.sim.ability.TargetSpec;
import com.mtg.sim.card.ManaType;
import com.mtg.sim.game.zones.Permanent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies resolved effects to the game.
 */
public class EffectResolver {
    private static final Logger log = LoggerFactory.getLogger(EffectResolver.class);

    private final Game game;

    public EffectResolver(Game game) {
        this.game = game;
    }

    /**
     * Apply one effect.
     *
     * @param target the chosen target for targeted effects, ignored otherwise
     * @return permanents destroyed by the effect
     */
    public List<Permanent> apply(Effect effect, Target target, EffectContext ctx) {
        List<Permanent> destroyed = new ArrayList<>(0);
        Player controller = game.getPlayer(ctx.controllerSeat());

        switch (effect.type()) {
            case DEAL_DAMAGE -> {
                Effect.DealDamage damage = (Effect.DealDamage) effect;
                switch (damage.target()) {
                    case EACH_OPPONENT -> {
                        for (int seat : controller.getOpponentSeats()) {
                            damagePlayer(game.getPlayer(seat), damage.amount(), ctx);
                        }
                    }
                    case CONTROLLER -> damagePlayer(controller, damage.amount(), ctx);
                    case SOURCE -> sourcePermanent(ctx).ifPresent(p -> damagePermanent(p, damage.amount(), ctx));
                    default -> damageTarget(target, damage.amount(), ctx);
                }
            }
            case GAIN_LIFE -> {
                Effect.GainLife gain = (Effect.GainLife) effect;
                Player player = playerFor(gain.target(), target, controller);
                if (player != null) {
                    player.gainLife(gain.amount());
                    log.debug("{} gains {} life ({})", player.getName(), gain.amount(), player.getLife());
                }
            }
            case LOSE_LIFE -> {
                Effect.LoseLife lose = (Effect.LoseLife) effect;
                if (lose.target() == TargetSpec.EACH_OPPONENT) {
                    for (int seat : controller.getOpponentSeats()) {
                        game.getPlayer(seat).loseLife(lose.amount());
                    }
                } else {
                    Player player = playerFor(lose.target(), target, controller);
                    if (player != null) {
                        player.loseLife(lose.amount());
                    }
                }
            }
            case DRAW_CARDS -> {
                Effect.DrawCards draw = (Effect.DrawCards) effect;
                Player player = playerFor(draw.target(), target, controller);
                if (player != null) {
                    int drawn = player.drawCards(draw.count());
                    log.debug("{} draws {} card(s)", player.getName(), drawn);
                }
            }
            case ADD_MANA -> {
                Effect.AddMana addMana = (Effect.AddMana) effect;
                addMana(controller, addMana, null);
            }
            case MODIFY_STATS -> {
                Effect.ModifyStats modify = (Effect.ModifyStats) effect;
                Optional<Permanent> permanent = modify.target() == TargetSpec.SOURCE
                        ? sourcePermanent(ctx)
                        : targetPermanent(target);
                permanent.ifPresent(p -> {
                    if (modify.duration() == EffectDuration.UNTIL_END_OF_TURN) {
                        p.modifyUntilEndOfTurn(modify.power(), modify.toughness());
                    } else {
                        p.modifyBase(modify.power(), modify.toughness());
                    }
                    log.debug("{} becomes {}/{}", p.getName(), p.getPower(), p.getToughness());
                });
            }
            case DESTROY_PERMANENT -> targetPermanent(target).ifPresent(p -> {
                if (game.destroy(p)) {
                    destroyed.add(p);
                }
            });
            case COUNTER_SPELL -> {
                if (target instanceof Target.SpellTarget spellTarget) {
                    Optional<StackItem> countered = game.getStack().find(spellTarget.stackItemId());
                    if (countered.isPresent()) {
                        countered.get().markCountered();
                        log.debug("{} counters {}", ctx.sourceName(), countered.get().getName());
                    } else {
                        log.debug("{} finds nothing to counter", ctx.sourceName());
                    }
                }
            }
            case TAP_PERMANENT -> {
                Effect.TapPermanent tap = (Effect.TapPermanent) effect;
                targetPermanent(target).ifPresent(p -> {
                    if (tap.untap()) {
                        p.untap();
                    } else if (!p.isTapped()) {
                        p.tap();
                    }
                });
            }
            case GAIN_PROTECTION -> log.trace("Protection is static and read from the permanent");
        }
        return destroyed;
    }

    /**
     * Add mana from a mana ability, honoring the requested type where the ability allows it.
     */
    public void addMana(Player player, Effect.AddMana addMana, ManaType requested) {
        ManaType produced = addMana.produce(requested);
        player.getManaPool().add(produced, addMana.amount());
        log.trace("{} adds {} {}", player.getName(), addMana.amount(), produced);
    }

    private void damageTarget(Target target, int amount, EffectContext ctx) {
        if (target instanceof Target.PlayerTarget playerTarget) {
            damagePlayer(game.getPlayer(playerTarget.seat()), amount, ctx);
        } else {
            targetPermanent(target).ifPresent(p -> damagePermanent(p, amount, ctx));
        }
    }

    private void damagePlayer(Player player, int amount, EffectContext ctx) {
        if (amount <= 0) {
            return;
        }
        player.loseLife(amount);
        log.debug("{} deals {} damage to {} ({} life)", ctx.sourceName(), amount, player.getName(), player.getLife());
        applyLifelink(amount, ctx);
    }

    private void damagePermanent(Permanent permanent, int amount, EffectContext ctx) {
        if (amount <= 0) {
            return;
        }
        if (permanent.isProtectedFrom(ctx.sourceColors(), ctx.sourceIsArtifact())) {
            log.debug("Damage from {} to {} is prevented by protection", ctx.sourceName(), permanent.getName());
            return;
        }
        permanent.dealDamage(amount, ctx.deathtouch());
        log.debug("{} deals {} damage to {}", ctx.sourceName(), amount, permanent);
        applyLifelink(amount, ctx);
    }

    private void applyLifelink(int amount, EffectContext ctx) {
        if (ctx.lifelink()) {
            game.getPlayer(ctx.controllerSeat()).gainLife(amount);
        }
    }

    private Player playerFor(TargetSpec spec, Target target, Player controller) {
        if (spec == TargetSpec.CONTROLLER || spec == TargetSpec.NONE) {
            return controller;
        }
        if (target instanceof Target.PlayerTarget playerTarget) {
            return game.getPlayer(playerTarget.seat());
        }
        return null;
    }

    private Optional<Permanent> targetPermanent(Target target) {
        if (target instanceof Target.PermanentTarget permanentTarget) {
            return game.findPermanent(permanentTarget.permanentId());
        }
        return Optional.empty();
    }

    private Optional<Permanent> sourcePermanent(EffectContext ctx) {
        if (ctx.sourcePermanentId() == null) {
            return Optional.empty();
        }
        return game.findPermanent(ctx.sourcePermanentId());
    }
}
