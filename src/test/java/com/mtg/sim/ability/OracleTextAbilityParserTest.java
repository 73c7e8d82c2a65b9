package com.mtg.sim.ability;

import com.mtg.sim.card.Card;
import com.mtg.sim.card.ManaCost;
import com.mtg.sim.card.ManaType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OracleTextAbilityParser.
 */
class OracleTextAbilityParserTest {

    private final OracleTextAbilityParser parser = new OracleTextAbilityParser();

    private static Card card(String name, String typeLine, String text) {
        return new Card(name, "{1}", typeLine, text, null, null, List.of());
    }

    @Test
    void testBasicLandReminderTextIsItsManaAbility() {
        List<Ability> abilities = parser.parseAbilities(card("Forest", "Basic Land — Forest", "({T}: Add {G}.)"));
        assertEquals(1, abilities.size());
        Ability.Mana mana = assertInstanceOf(Ability.Mana.class, abilities.get(0));
        assertTrue(mana.cost().tap());
        assertEquals(List.of(ManaType.GREEN), mana.production().options());
        assertEquals(1, mana.production().amount());
    }

    @Test
    void testAnyColorMana() {
        List<Ability> abilities = parser.parseAbilities(
                card("Birds of Paradise", "Creature — Bird", "Flying\n{T}: Add one mana of any color."));
        assertEquals(1, abilities.size());
        Ability.Mana mana = assertInstanceOf(Ability.Mana.class, abilities.get(0));
        assertEquals(List.of(ManaType.ANY), mana.production().options());
        assertEquals(ManaType.BLUE, mana.production().produce(ManaType.BLUE));
    }

    @Test
    void testChoiceAndMultipleMana() {
        Ability.Mana choice = (Ability.Mana) parser.parseAbilities(
                card("Karplusan Forest", "Land", "{T}: Add {R} or {G}.")).get(0);
        assertEquals(List.of(ManaType.RED, ManaType.GREEN), choice.production().options());
        assertEquals(ManaType.GREEN, choice.production().produce(ManaType.GREEN));
        assertEquals(ManaType.RED, choice.production().produce(null));

        Ability.Mana two = (Ability.Mana) parser.parseAbilities(
                card("Sol Ring", "Artifact", "{T}: Add {C}{C}.")).get(0);
        assertEquals(List.of(ManaType.COLORLESS), two.production().options());
        assertEquals(2, two.production().amount());
    }

    @Test
    void testDamageSpell() {
        List<Effect> effects = parser.parseSpellEffects(
                card("Lightning Bolt", "Instant", "Lightning Bolt deals 3 damage to any target."));
        assertEquals(List.of(new Effect.DealDamage(3, TargetSpec.ANY_TARGET)), effects);
    }

    @Test
    void testCounterSpell() {
        List<Effect> effects = parser.parseSpellEffects(card("Counterspell", "Instant", "Counter target spell."));
        assertEquals(List.of(Effect.CounterSpell.TARGET_SPELL), effects);
    }

    @Test
    void testPumpSpell() {
        List<Effect> effects = parser.parseSpellEffects(
                card("Giant Growth", "Instant", "Target creature gets +3/+3 until end of turn."));
        assertEquals(List.of(new Effect.ModifyStats(3, 3, TargetSpec.TARGET_CREATURE,
                EffectDuration.UNTIL_END_OF_TURN)), effects);
    }

    @Test
    void testEffectsKeepTextOrder() {
        List<Effect> effects = parser.parseSpellEffects(card("Douse in Gloom", "Instant",
                "Douse in Gloom deals 2 damage to target creature and you gain 2 life."));
        assertEquals(2, effects.size());
        assertEquals(new Effect.DealDamage(2, TargetSpec.TARGET_CREATURE), effects.get(0));
        assertEquals(new Effect.GainLife(2, TargetSpec.CONTROLLER), effects.get(1));
    }

    @Test
    void testDrawAndDestroy() {
        assertEquals(List.of(new Effect.DrawCards(2, TargetSpec.CONTROLLER)),
                parser.parseSpellEffects(card("Divination", "Sorcery", "Draw two cards.")));
        assertEquals(List.of(new Effect.DestroyPermanent(TargetSpec.TARGET_CREATURE)),
                parser.parseSpellEffects(card("Murder", "Instant", "Destroy target creature.")));
    }

    @Test
    void testActivatedAbility() {
        List<Ability> abilities = parser.parseAbilities(card("Prodigal Pyromancer", "Creature — Human Wizard",
                "{T}: Prodigal Pyromancer deals 1 damage to any target."));
        assertEquals(1, abilities.size());
        Ability.Activated ability = assertInstanceOf(Ability.Activated.class, abilities.get(0));
        assertEquals(Cost.TAP, ability.cost());
        assertEquals(TimingRestriction.INSTANT_SPEED, ability.timing());
        assertEquals(List.of(new Effect.DealDamage(1, TargetSpec.ANY_TARGET)), ability.effects());
        assertTrue(ability.isTargeted());
    }

    @Test
    void testSorcerySpeedActivation() {
        List<Ability> abilities = parser.parseAbilities(card("Jayemdae Tome", "Artifact",
                "{2}, {T}: Draw a card. Activate only as a sorcery."));
        assertEquals(1, abilities.size());
        Ability.Activated ability = (Ability.Activated) abilities.get(0);
        assertEquals(TimingRestriction.SORCERY_SPEED, ability.timing());
        assertEquals(Cost.manaAndTap(ManaCost.generic(2)), ability.cost());
        assertFalse(ability.isTargeted());
    }

    @Test
    void testLifeCost() {
        Cost cost = OracleTextAbilityParser.parseCost("{B}, Pay 2 life");
        assertEquals(2, cost.life());
        assertFalse(cost.tap());
        assertEquals(1, cost.mana().get(ManaType.BLACK));
    }

    @Test
    void testTriggers() {
        Ability.Triggered etb = (Ability.Triggered) parser.parseAbilities(card("Shivan Firecaller",
                "Creature — Human Shaman",
                "When Shivan Firecaller enters the battlefield, it deals 2 damage to any target.")).get(0);
        assertEquals(TriggerCondition.ENTERS_THE_BATTLEFIELD, etb.trigger());
        assertEquals(List.of(new Effect.DealDamage(2, TargetSpec.ANY_TARGET)), etb.effects());

        Ability.Triggered dies = (Ability.Triggered) parser.parseAbilities(card("Gravedigger Imp",
                "Creature — Imp", "Flying\nWhen Gravedigger Imp dies, you gain 2 life.")).get(0);
        assertEquals(TriggerCondition.DIES, dies.trigger());

        Ability.Triggered upkeep = (Ability.Triggered) parser.parseAbilities(card("Phyrexian Arena",
                "Enchantment", "At the beginning of your upkeep, you draw a card and you lose 1 life.")).get(0);
        assertEquals(TriggerCondition.BEGINNING_OF_UPKEEP, upkeep.trigger());
        assertEquals(2, upkeep.effects().size());
    }

    @Test
    void testTriggersAreNotSpellEffects() {
        Card firecaller = card("Shivan Firecaller", "Creature — Human Shaman",
                "When Shivan Firecaller enters the battlefield, it deals 2 damage to any target.");
        assertTrue(parser.parseSpellEffects(firecaller).isEmpty());
    }

    @Test
    void testProtection() {
        List<Ability> abilities = parser.parseAbilities(card("White Knight", "Creature — Human Knight",
                "First strike\nProtection from black"));
        assertEquals(1, abilities.size());
        Ability.Static ability = assertInstanceOf(Ability.Static.class, abilities.get(0));
        assertEquals(List.of(new Effect.GainProtection(ProtectionQuality.BLACK)), ability.effects());
    }

    @Test
    void testUnrecognizedTextProducesNothing() {
        assertTrue(parser.parseAbilities(card("Goblin Piker", "Creature", "Goblin Piker can't block.")).isEmpty());
        assertTrue(parser.parseAbilities(card("Vanilla", "Creature", "")).isEmpty());
        assertTrue(parser.parseSpellEffects(card("Odd", "Sorcery", "Shuffle your library.")).isEmpty());
    }

    @Test
    void testSplitStripsReminderText() {
        assertEquals(List.of("Flying"),
                OracleTextAbilityParser.splitOracleText("Flying (This creature can't be blocked except by creatures with flying or reach.)"));
        assertEquals(List.of("Draw a card", "Activate only as a sorcery"),
                OracleTextAbilityParser.splitOracleText("Draw a card. Activate only as a sorcery."));
    }
}
