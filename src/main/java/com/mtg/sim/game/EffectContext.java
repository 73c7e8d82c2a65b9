package com.mtg.sim.game;

import com.mtg.sim.card.ColorFlags;
import com.mtg.sim.card.Keyword;
import com.mtg.sim.game.zones.Permanent;

/**
 * Who is applying an effect and what its source looks like.
 *
 * @param sourcePermanentId the source permanent, or null for a spell
 */
public record EffectContext(int controllerSeat, Long sourcePermanentId, String sourceName,
                            ColorFlags sourceColors, boolean sourceIsArtifact,
                            boolean deathtouch, boolean lifelink) {

    public static EffectContext forStackItem(StackItem item, Permanent sourceOnBattlefield) {
        if (item instanceof StackItem.AbilityItem ability) {
            boolean deathtouch = sourceOnBattlefield != null && sourceOnBattlefield.hasKeyword(Keyword.DEATHTOUCH);
            boolean lifelink = sourceOnBattlefield != null && sourceOnBattlefield.hasKeyword(Keyword.LIFELINK);
            return new EffectContext(item.getControllerSeat(), ability.getSourceId(),
                    ability.getSourceCard().getName(), item.getColors(), item.isArtifactSource(),
                    deathtouch, lifelink);
        }
        StackItem.Spell spell = (StackItem.Spell) item;
        return new EffectContext(item.getControllerSeat(), null, spell.getCard().getName(),
                item.getColors(), item.isArtifactSource(),
                spell.getCard().hasKeyword(Keyword.DEATHTOUCH), spell.getCard().hasKeyword(Keyword.LIFELINK));
    }

    public static EffectContext forPermanent(Permanent source) {
        return new EffectContext(source.getControllerSeat(), source.getId(), source.getName(),
                source.getColors(), source.isArtifact(),
                source.hasKeyword(Keyword.DEATHTOUCH), source.hasKeyword(Keyword.LIFELINK));
    }
}
