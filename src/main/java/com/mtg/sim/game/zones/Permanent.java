package com.mtg.sim.game.zones;

import com.mtg.sim.ability.Ability;
import com.mtg.sim.ability.Effect;
import com.mtg.sim.ability.EffectType;
import com.mtg.sim.ability.ProtectionQuality;
import com.mtg.sim.ability.TriggerCondition;
import com.mtg.sim.card.Card;
import com.mtg.sim.card.ColorFlags;
import com.mtg.sim.card.Keyword;
import com.mtg.sim.card.ManaType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A card on the battlefield. Other objects refer to it by {@link #getId()} only;
 * combat links (attacking seat, blocked attacker, blockers) are ids as well.
 */
public class Permanent {
    private final long id;
    private final Card card;
    private final int ownerSeat;
    private final PermanentKind kind;
    private final List<Ability> abilities;
    private final EnumSet<Keyword> keywords;
    private final EnumSet<ProtectionQuality> protections;
    private final int enteredTurn;

    private int basePower;
    private int baseToughness;
    private int powerUntilEndOfTurn;
    private int toughnessUntilEndOfTurn;

    private int damage;
    private boolean deathtouchDamaged;
    private boolean tapped;
    private boolean summoningSick;
    private Integer goadedBySeat;

    // Combat state
    private Integer attackingSeat;
    private Long blockingId;
    private final List<Long> blockedByIds = new ArrayList<>();
    private boolean wasBlocked;

    public Permanent(long id, Card card, int ownerSeat, List<Ability> abilities, int enteredTurn) {
        this.id = id;
        this.card = card;
        this.ownerSeat = ownerSeat;
        this.kind = PermanentKind.of(card);
        this.abilities = List.copyOf(abilities);
        this.keywords = EnumSet.noneOf(Keyword.class);
        this.keywords.addAll(card.getKeywords());
        this.protections = EnumSet.noneOf(ProtectionQuality.class);
        for (Ability ability : abilities) {
            if (ability.kind() != Ability.Kind.STATIC) {
                continue;
            }
            for (Effect effect : ability.effects()) {
                if (effect.type() == EffectType.GAIN_PROTECTION) {
                    protections.add(((Effect.GainProtection) effect).quality());
                }
            }
        }
        this.enteredTurn = enteredTurn;
        this.basePower = card.getPowerValue();
        this.baseToughness = card.getToughnessValue();
        this.summoningSick = card.isCreature();
    }

    public long getId() {
        return id;
    }

    public Card getCard() {
        return card;
    }

    public String getName() {
        return card.getName();
    }

    public int getOwnerSeat() {
        return ownerSeat;
    }

    /**
     * Controller seat. Control never changes hands, so this is the owner.
     */
    public int getControllerSeat() {
        return ownerSeat;
    }

    public PermanentKind getKind() {
        return kind;
    }

    public int getEnteredTurn() {
        return enteredTurn;
    }

    public boolean isCreature() {
        return card.isCreature();
    }

    public boolean isLand() {
        return card.isLand();
    }

    public boolean isArtifact() {
        return card.isArtifact();
    }

    public ColorFlags getColors() {
        return card.getColors();
    }

    // ---- Abilities and keywords ----

    public List<Ability> getAbilities() {
        return abilities;
    }

    public boolean hasKeyword(Keyword keyword) {
        return keywords.contains(keyword);
    }

    public Set<Keyword> getKeywords() {
        return EnumSet.copyOf(keywords);
    }

    public boolean hasProtectionFrom(ProtectionQuality quality) {
        return protections.contains(quality);
    }

    public Set<ProtectionQuality> getProtections() {
        return EnumSet.copyOf(protections);
    }

    /**
     * True if the given object (by colors and artifact-ness) matches one of this
     * permanent's protection qualities.
     */
    public boolean isProtectedFrom(ColorFlags colors, boolean artifact) {
        for (ProtectionQuality quality : protections) {
            if (quality == ProtectionQuality.ARTIFACTS) {
                if (artifact) {
                    return true;
                }
            } else if (colors.contains(quality.getColor())) {
                return true;
            }
        }
        return false;
    }

    public List<Ability.Mana> getManaAbilities() {
        List<Ability.Mana> result = new ArrayList<>(1);
        for (Ability ability : abilities) {
            if (ability.kind() == Ability.Kind.MANA) {
                result.add((Ability.Mana) ability);
            }
        }
        return result;
    }

    public List<Ability.Triggered> getTriggeredAbilities(TriggerCondition condition) {
        List<Ability.Triggered> result = new ArrayList<>(1);
        for (Ability ability : abilities) {
            if (ability.kind() == Ability.Kind.TRIGGERED) {
                Ability.Triggered triggered = (Ability.Triggered) ability;
                if (triggered.trigger() == condition) {
                    result.add(triggered);
                }
            }
        }
        return result;
    }

    public boolean isManaProducer() {
        return !getManaAbilities().isEmpty();
    }

    /**
     * Mana types this permanent can produce, in ability order.
     */
    public Set<ManaType> getProducedTypes() {
        Set<ManaType> types = new LinkedHashSet<>();
        for (Ability.Mana mana : getManaAbilities()) {
            types.addAll(mana.production().options());
        }
        return types;
    }

    // ---- Power, toughness and damage ----

    public int getPower() {
        return basePower + powerUntilEndOfTurn;
    }

    public int getToughness() {
        return baseToughness + toughnessUntilEndOfTurn;
    }

    public void modifyUntilEndOfTurn(int power, int toughness) {
        powerUntilEndOfTurn += power;
        toughnessUntilEndOfTurn += toughness;
    }

    public void modifyBase(int power, int toughness) {
        basePower += power;
        baseToughness += toughness;
    }

    public int getDamage() {
        return damage;
    }

    public boolean isDeathtouchDamaged() {
        return deathtouchDamaged;
    }

    /**
     * Mark damage on this permanent.
     * @param fromDeathtouch whether the source had deathtouch
     */
    public void dealDamage(int amount, boolean fromDeathtouch) {
        if (amount <= 0) {
            return;
        }
        damage += amount;
        if (fromDeathtouch) {
            deathtouchDamaged = true;
        }
    }

    /**
     * Damage still needed before this creature has lethal damage marked.
     */
    public int getLethalDamageRemaining() {
        return Math.max(0, getToughness() - damage);
    }

    public void clearDamage() {
        damage = 0;
        deathtouchDamaged = false;
    }

    /**
     * Cleanup-step housekeeping: remove damage and expire until-end-of-turn modifiers.
     */
    public void endOfTurnCleanup() {
        clearDamage();
        powerUntilEndOfTurn = 0;
        toughnessUntilEndOfTurn = 0;
    }

    // ---- Tapping and sickness ----

    public boolean isTapped() {
        return tapped;
    }

    /**
     * Tap this permanent.
     * @throws IllegalStateException if it is already tapped
     */
    public void tap() {
        if (tapped) {
            throw new IllegalStateException(getName() + " (#" + id + ") is already tapped");
        }
        tapped = true;
    }

    public void untap() {
        tapped = false;
    }

    public boolean isSummoningSick() {
        return summoningSick;
    }

    public void setSummoningSick(boolean summoningSick) {
        this.summoningSick = summoningSick;
    }

    /**
     * Whether {T} costs of non-mana abilities and attacking are currently allowed.
     */
    public boolean canUseTapAbilities() {
        return !summoningSick || !isCreature() || hasKeyword(Keyword.HASTE);
    }

    public boolean isGoaded() {
        return goadedBySeat != null;
    }

    /**
     * Goad this creature. It attacks each combat if able until the goading
     * player's next turn begins. Goad comes from effects outside the card text
     * this engine parses, so only callers of this method apply it.
     */
    public void goad(int goaderSeat) {
        this.goadedBySeat = goaderSeat;
    }

    /**
     * The given player's turn has begun: goad that player applied ends.
     */
    public void endGoadFrom(int goaderSeat) {
        if (goadedBySeat != null && goadedBySeat == goaderSeat) {
            goadedBySeat = null;
        }
    }

    // ---- Combat state ----

    public boolean isAttacking() {
        return attackingSeat != null;
    }

    public Integer getAttackingSeat() {
        return attackingSeat;
    }

    public void setAttackingSeat(Integer attackingSeat) {
        this.attackingSeat = attackingSeat;
    }

    public boolean isBlocking() {
        return blockingId != null;
    }

    public Long getBlockingId() {
        return blockingId;
    }

    public void setBlockingId(Long blockingId) {
        this.blockingId = blockingId;
    }

    /**
     * Ids of the creatures blocking this attacker, in damage assignment order.
     */
    public List<Long> getBlockedByIds() {
        return List.copyOf(blockedByIds);
    }

    public void addBlocker(long blockerId) {
        blockedByIds.add(blockerId);
        wasBlocked = true;
    }

    public void removeBlocker(long blockerId) {
        blockedByIds.remove(Long.valueOf(blockerId));
    }

    /**
     * True once any creature blocked this attacker, even if all blockers have since left.
     */
    public boolean wasBlocked() {
        return wasBlocked;
    }

    public void clearCombatState() {
        attackingSeat = null;
        blockingId = null;
        blockedByIds.clear();
        wasBlocked = false;
    }

    @Override
    public String toString() {
        if (isCreature()) {
            return getName() + " #" + id + " (" + getPower() + "/" + getToughness() + ")";
        }
        return getName() + " #" + id;
    }
}
