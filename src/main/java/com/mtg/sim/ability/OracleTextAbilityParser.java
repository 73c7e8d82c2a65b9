package com.mtg.sim.ability;

import com.mtg.sim.card.Card;
import com.mtg.sim.card.ManaCost;
import com.mtg.sim.card.ManaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based parser for the common oracle-text templates.
 * Text it does not recognize produces no abilities.
 */
public class OracleTextAbilityParser implements AbilityParser {
    private static final Logger log = LoggerFactory.getLogger(OracleTextAbilityParser.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern ANY_COLOR_MANA =
            Pattern.compile("^\\{T\\}:\\s*Add\\s+one\\s+mana\\s+of\\s+any\\s+colou?r", FLAGS);
    private static final Pattern SYMBOL_MANA =
            Pattern.compile("^\\{T\\}:\\s*Add\\s+(\\{[WUBRGC]\\}.*)$", FLAGS);
    private static final Pattern MANA_SYMBOL = Pattern.compile("\\{([WUBRGC])\\}", FLAGS);

    private static final Pattern ETB_TRIGGER =
            Pattern.compile("^When(?:ever)?\\s+.+?\\s+enters(?:\\s+the\\s+battlefield)?,\\s+(.+)$", FLAGS);
    private static final Pattern DIES_TRIGGER =
            Pattern.compile("^When(?:ever)?\\s+.+?\\s+dies,\\s+(.+)$", FLAGS);
    private static final Pattern UPKEEP_TRIGGER =
            Pattern.compile("^At\\s+the\\s+beginning\\s+of\\s+your\\s+upkeep,\\s+(.+)$", FLAGS);
    private static final Pattern END_STEP_TRIGGER =
            Pattern.compile("^At\\s+the\\s+beginning\\s+of\\s+(?:your|each)\\s+end\\s+step,\\s+(.+)$", FLAGS);

    private static final Pattern ACTIVATED =
            Pattern.compile("^((?:\\{[^}]+\\}|Pay\\s+\\d+\\s+life)(?:\\s*,\\s*(?:\\{[^}]+\\}|Pay\\s+\\d+\\s+life))*)\\s*:\\s*(.+)$", FLAGS);
    private static final Pattern SORCERY_ONLY =
            Pattern.compile("^Activate\\s+(?:this\\s+ability\\s+)?only\\s+(?:any\\s+time\\s+you\\s+could\\s+cast\\s+a\\s+sorcery|as\\s+a\\s+sorcery)", FLAGS);
    private static final Pattern PAY_LIFE = Pattern.compile("Pay\\s+(\\d+)\\s+life", FLAGS);
    private static final Pattern COST_SYMBOL = Pattern.compile("\\{([^}]+)\\}");

    private static final Pattern PROTECTION = Pattern.compile("(?:^|,\\s*)Protection\\s+from\\s+(\\w+(?:\\s+and\\s+from\\s+\\w+)*)", FLAGS);
    private static final Pattern PROTECTION_QUALITY = Pattern.compile("(\\w+)");

    private static final Pattern DAMAGE = Pattern.compile(
            "deals?\\s+(\\d+)\\s+damage\\s+to\\s+(any\\s+target|target\\s+creature\\s+or\\s+player|"
                    + "target\\s+player(?:\\s+or\\s+planeswalker)?|target\\s+creature|each\\s+opponent|you)", FLAGS);
    private static final Pattern COUNTER = Pattern.compile("counter\\s+target\\s+spell", FLAGS);
    private static final Pattern DRAW = Pattern.compile(
            "draws?\\s+(a|one|two|three|four|five|\\d+)\\s+cards?", FLAGS);
    private static final Pattern GAIN_LIFE = Pattern.compile("you\\s+gain\\s+(\\d+)\\s+life", FLAGS);
    private static final Pattern LOSE_LIFE = Pattern.compile(
            "(each\\s+opponent|target\\s+player|target\\s+opponent|you)\\s+loses?\\s+(\\d+)\\s+life", FLAGS);
    private static final Pattern DESTROY = Pattern.compile(
            "destroy\\s+target\\s+(creature|permanent|artifact|enchantment)", FLAGS);
    private static final Pattern PUMP = Pattern.compile(
            "(target\\s+creature\\s+)?gets\\s+([+-]\\d+)/([+-]\\d+)(\\s+until\\s+end\\s+of\\s+turn)?", FLAGS);
    private static final Pattern TAP = Pattern.compile(
            "(tap|untap)\\s+target\\s+(creature|permanent|artifact|land)", FLAGS);

    @Override
    public List<Ability> parseAbilities(Card card) {
        List<Ability> abilities = new ArrayList<>();
        List<String> sentences = splitOracleText(card.getOracleText());
        for (int i = 0; i < sentences.size(); i++) {
            String sentence = sentences.get(i);
            // The restriction is its own sentence after the ability
            boolean sorceryOnly = i + 1 < sentences.size() && SORCERY_ONLY.matcher(sentences.get(i + 1)).find();
            Ability ability = parseAbilitySentence(card.getName(), sentence, sorceryOnly);
            if (ability != null) {
                abilities.add(ability);
            } else {
                log.trace("No ability parsed from '{}' on {}", sentence, card.getName());
            }
        }
        return abilities;
    }

    @Override
    public List<Effect> parseSpellEffects(Card card) {
        List<Effect> effects = new ArrayList<>();
        for (String sentence : splitOracleText(card.getOracleText())) {
            if (ACTIVATED.matcher(sentence).find() || isTriggerSentence(sentence)) {
                continue;
            }
            List<Effect> parsed = parseEffects(sentence);
            if (parsed.isEmpty()) {
                log.debug("Unparsed spell text on {}: '{}'", card.getName(), sentence);
            }
            effects.addAll(parsed);
        }
        return effects;
    }

    private Ability parseAbilitySentence(String cardName, String sentence, boolean sorceryOnly) {
        if (ANY_COLOR_MANA.matcher(sentence).find()) {
            return new Ability.Mana(cardName + " mana", Cost.TAP,
                    new Effect.AddMana(List.of(ManaType.ANY), 1));
        }

        Matcher m = SYMBOL_MANA.matcher(sentence);
        if (m.find()) {
            return parseSymbolMana(cardName, m.group(1));
        }

        Ability triggered = parseTrigger(cardName, sentence);
        if (triggered != null) {
            return triggered;
        }

        m = ACTIVATED.matcher(sentence);
        if (m.find()) {
            List<Effect> effects = parseEffects(m.group(2));
            if (effects.isEmpty()) {
                return null;
            }
            TimingRestriction timing = sorceryOnly ? TimingRestriction.SORCERY_SPEED : TimingRestriction.INSTANT_SPEED;
            return new Ability.Activated(cardName + " ability", parseCost(m.group(1)), timing, effects);
        }

        m = PROTECTION.matcher(sentence);
        if (m.find()) {
            List<Effect> protections = new ArrayList<>();
            Matcher q = PROTECTION_QUALITY.matcher(m.group(1));
            while (q.find()) {
                ProtectionQuality quality = ProtectionQuality.fromText(q.group(1));
                if (quality != null) {
                    protections.add(new Effect.GainProtection(quality));
                }
            }
            return protections.isEmpty() ? null : new Ability.Static(cardName + " protection", protections);
        }
        return null;
    }

    private Ability parseSymbolMana(String cardName, String produced) {
        List<ManaType> symbols = new ArrayList<>();
        Matcher symbol = MANA_SYMBOL.matcher(produced);
        while (symbol.find()) {
            symbols.add(ManaType.fromChar(symbol.group(1).charAt(0)));
        }
        if (symbols.isEmpty()) {
            return null;
        }
        Effect.AddMana production;
        if (produced.toLowerCase().contains(" or ")) {
            production = new Effect.AddMana(symbols, 1);
        } else {
            // "{C}{C}" adds two of one type
            production = new Effect.AddMana(List.of(symbols.get(0)), symbols.size());
        }
        return new Ability.Mana(cardName + " mana", Cost.TAP, production);
    }

    private Ability parseTrigger(String cardName, String sentence) {
        TriggerCondition condition = null;
        Matcher m = ETB_TRIGGER.matcher(sentence);
        if (m.find()) {
            condition = TriggerCondition.ENTERS_THE_BATTLEFIELD;
        } else if ((m = DIES_TRIGGER.matcher(sentence)).find()) {
            condition = TriggerCondition.DIES;
        } else if ((m = UPKEEP_TRIGGER.matcher(sentence)).find()) {
            condition = TriggerCondition.BEGINNING_OF_UPKEEP;
        } else if ((m = END_STEP_TRIGGER.matcher(sentence)).find()) {
            condition = TriggerCondition.END_STEP;
        }
        if (condition == null) {
            return null;
        }
        List<Effect> effects = parseEffects(m.group(1));
        if (effects.isEmpty()) {
            return null;
        }
        return new Ability.Triggered(cardName + " trigger", condition, effects);
    }

    private static boolean isTriggerSentence(String sentence) {
        return ETB_TRIGGER.matcher(sentence).find()
                || DIES_TRIGGER.matcher(sentence).find()
                || UPKEEP_TRIGGER.matcher(sentence).find()
                || END_STEP_TRIGGER.matcher(sentence).find();
    }

    static Cost parseCost(String costText) {
        boolean tap = false;
        int life = 0;
        StringBuilder mana = new StringBuilder();

        Matcher lifeMatcher = PAY_LIFE.matcher(costText);
        while (lifeMatcher.find()) {
            life += Integer.parseInt(lifeMatcher.group(1));
        }
        Matcher symbol = COST_SYMBOL.matcher(costText);
        while (symbol.find()) {
            String token = symbol.group(1).trim();
            if (token.equalsIgnoreCase("T")) {
                tap = true;
            } else {
                mana.append('{').append(token).append('}');
            }
        }
        return new Cost(ManaCost.parse(mana.toString()), tap, life);
    }

    /**
     * Parse every effect found in one clause, in text order.
     */
    static List<Effect> parseEffects(String clause) {
        List<PositionedEffect> found = new ArrayList<>();

        Matcher m = DAMAGE.matcher(clause);
        while (m.find()) {
            found.add(new PositionedEffect(m.start(),
                    new Effect.DealDamage(Integer.parseInt(m.group(1)), damageTarget(m.group(2)))));
        }
        m = COUNTER.matcher(clause);
        while (m.find()) {
            found.add(new PositionedEffect(m.start(), Effect.CounterSpell.TARGET_SPELL));
        }
        m = DRAW.matcher(clause);
        while (m.find()) {
            found.add(new PositionedEffect(m.start(),
                    new Effect.DrawCards(parseCount(m.group(1)), TargetSpec.CONTROLLER)));
        }
        m = GAIN_LIFE.matcher(clause);
        while (m.find()) {
            found.add(new PositionedEffect(m.start(),
                    new Effect.GainLife(Integer.parseInt(m.group(1)), TargetSpec.CONTROLLER)));
        }
        m = LOSE_LIFE.matcher(clause);
        while (m.find()) {
            found.add(new PositionedEffect(m.start(),
                    new Effect.LoseLife(Integer.parseInt(m.group(2)), loseLifeTarget(m.group(1)))));
        }
        m = DESTROY.matcher(clause);
        while (m.find()) {
            TargetSpec spec = m.group(1).equalsIgnoreCase("creature")
                    ? TargetSpec.TARGET_CREATURE
                    : TargetSpec.TARGET_PERMANENT;
            found.add(new PositionedEffect(m.start(), new Effect.DestroyPermanent(spec)));
        }
        m = PUMP.matcher(clause);
        while (m.find()) {
            TargetSpec spec = m.group(1) != null ? TargetSpec.TARGET_CREATURE : TargetSpec.SOURCE;
            EffectDuration duration = m.group(4) != null ? EffectDuration.UNTIL_END_OF_TURN : EffectDuration.PERMANENT;
            found.add(new PositionedEffect(m.start(), new Effect.ModifyStats(
                    Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)), spec, duration)));
        }
        m = TAP.matcher(clause);
        while (m.find()) {
            TargetSpec spec = m.group(2).equalsIgnoreCase("creature")
                    ? TargetSpec.TARGET_CREATURE
                    : TargetSpec.TARGET_PERMANENT;
            found.add(new PositionedEffect(m.start(),
                    new Effect.TapPermanent(spec, m.group(1).equalsIgnoreCase("untap"))));
        }

        found.sort(Comparator.comparingInt(PositionedEffect::position));
        List<Effect> effects = new ArrayList<>(found.size());
        for (PositionedEffect positioned : found) {
            effects.add(positioned.effect());
        }
        return effects;
    }

    private static TargetSpec damageTarget(String text) {
        String t = text.toLowerCase().replaceAll("\\s+", " ");
        if (t.equals("target creature")) {
            return TargetSpec.TARGET_CREATURE;
        }
        if (t.startsWith("target player")) {
            return TargetSpec.TARGET_PLAYER;
        }
        if (t.equals("each opponent")) {
            return TargetSpec.EACH_OPPONENT;
        }
        if (t.equals("you")) {
            return TargetSpec.CONTROLLER;
        }
        return TargetSpec.ANY_TARGET;
    }

    private static TargetSpec loseLifeTarget(String text) {
        String t = text.toLowerCase();
        if (t.startsWith("each")) {
            return TargetSpec.EACH_OPPONENT;
        }
        if (t.startsWith("target")) {
            return TargetSpec.TARGET_PLAYER;
        }
        return TargetSpec.CONTROLLER;
    }

    private static int parseCount(String word) {
        return switch (word.toLowerCase()) {
            case "a", "one" -> 1;
            case "two" -> 2;
            case "three" -> 3;
            case "four" -> 4;
            case "five" -> 5;
            default -> Integer.parseInt(word);
        };
    }

    /**
     * Split oracle text into sentences, keeping braces intact.
     */
    static List<String> splitOracleText(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }
        for (String line : text.split("\\R")) {
            String stripped = line.trim();
            if (stripped.startsWith("(") && stripped.endsWith(")") && stripped.indexOf('(', 1) == -1) {
                // Basic lands print their mana ability as reminder text
                stripped = stripped.substring(1, stripped.length() - 1);
            } else {
                stripped = stripped.replaceAll("\\([^)]*\\)", "");
            }
            for (String sentence : stripped.split("\\.")) {
                String trimmed = sentence.trim();
                if (!trimmed.isEmpty()) {
                    sentences.add(trimmed);
                }
            }
        }
        return sentences;
    }

    private record PositionedEffect(int position, Effect effect) {
    }
}
