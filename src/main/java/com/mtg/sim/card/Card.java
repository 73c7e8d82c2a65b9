package com.mtg.sim.card;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Card data as stored in the card database (Scryfall field names).
 * Cards are shared between games and never mutated once loaded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Card {
    @JsonProperty("name")
    private String name;

    @JsonProperty("mana_cost")
    private String manaCost = "";

    @JsonProperty("cmc")
    private double cmc;

    @JsonProperty("type_line")
    private String typeLine = "";

    @JsonProperty("oracle_text")
    private String oracleText = "";

    @JsonProperty("power")
    private String power;

    @JsonProperty("toughness")
    private String toughness;

    @JsonProperty("keywords")
    private List<String> keywords = new ArrayList<>();

    @JsonProperty("colors")
    private List<String> colors;

    @JsonIgnore
    private volatile ManaCost parsedCost;

    public Card() {
        // Default constructor for Jackson
    }

    public Card(String name, String manaCost, String typeLine, String oracleText,
                String power, String toughness, List<String> keywords) {
        this.name = name;
        this.manaCost = manaCost != null ? manaCost : "";
        this.typeLine = typeLine != null ? typeLine : "";
        this.oracleText = oracleText != null ? oracleText : "";
        this.power = power;
        this.toughness = toughness;
        this.keywords = keywords != null ? new ArrayList<>(keywords) : new ArrayList<>();
        this.cmc = getParsedManaCost().getManaValue();
    }

    public String getName() {
        return name;
    }

    public String getManaCost() {
        return manaCost;
    }

    public double getCmc() {
        return cmc;
    }

    public String getTypeLine() {
        return typeLine;
    }

    public String getOracleText() {
        return oracleText;
    }

    public String getPower() {
        return power;
    }

    public String getToughness() {
        return toughness;
    }

    public List<String> getKeywordNames() {
        return Collections.unmodifiableList(keywords);
    }

    public void setColors(List<String> colors) {
        this.colors = colors != null ? new ArrayList<>(colors) : null;
    }

    /**
     * The printed mana cost parsed into categories, X counting as zero.
     */
    @JsonIgnore
    public ManaCost getParsedManaCost() {
        ManaCost cost = parsedCost;
        if (cost == null) {
            cost = ManaCost.parse(manaCost);
            parsedCost = cost;
        }
        return cost;
    }

    @JsonIgnore
    public int getManaValue() {
        return cmc > 0 ? (int) cmc : getParsedManaCost().getManaValue();
    }

    /**
     * Card types on the front of the type line (before the em dash).
     */
    @JsonIgnore
    public Set<CardType> getTypes() {
        EnumSet<CardType> types = EnumSet.noneOf(CardType.class);
        if (typeLine == null) {
            return types;
        }
        String front = typeLine;
        int dash = front.indexOf('—');
        if (dash == -1) {
            dash = front.indexOf(" - ");
        }
        if (dash != -1) {
            front = front.substring(0, dash);
        }
        // Split faces share one card entry; only the front face counts
        int faces = front.indexOf("//");
        if (faces != -1) {
            front = front.substring(0, faces);
        }
        for (String word : front.trim().split("\\s+")) {
            CardType type = CardType.fromWord(word);
            if (type != null) {
                types.add(type);
            }
        }
        return types;
    }

    public boolean hasType(CardType type) {
        return getTypes().contains(type);
    }

    @JsonIgnore
    public boolean isLand() {
        return hasType(CardType.LAND);
    }

    @JsonIgnore
    public boolean isCreature() {
        return hasType(CardType.CREATURE);
    }

    @JsonIgnore
    public boolean isArtifact() {
        return hasType(CardType.ARTIFACT);
    }

    @JsonIgnore
    public boolean isInstant() {
        return hasType(CardType.INSTANT);
    }

    @JsonIgnore
    public boolean isSorcery() {
        return hasType(CardType.SORCERY);
    }

    /**
     * True if the card becomes a permanent when it resolves.
     */
    @JsonIgnore
    public boolean isPermanentCard() {
        Set<CardType> types = getTypes();
        return !types.isEmpty() && !types.contains(CardType.INSTANT) && !types.contains(CardType.SORCERY);
    }

    /**
     * Keywords the engine models; unknown keywords are dropped.
     */
    @JsonIgnore
    public Set<Keyword> getKeywords() {
        EnumSet<Keyword> result = EnumSet.noneOf(Keyword.class);
        for (String keyword : keywords) {
            Keyword parsed = Keyword.fromName(keyword);
            if (parsed != null) {
                result.add(parsed);
            }
        }
        return result;
    }

    public boolean hasKeyword(Keyword keyword) {
        return getKeywords().contains(keyword);
    }

    /**
     * Card colors; falls back to the colors of the mana cost when the database omits them.
     */
    @JsonIgnore
    public ColorFlags getColors() {
        if (colors != null) {
            return ColorFlags.fromSymbols(colors);
        }
        return getParsedManaCost().getColors();
    }

    @JsonIgnore
    public int getPowerValue() {
        return parseStat(power);
    }

    @JsonIgnore
    public int getToughnessValue() {
        return parseStat(toughness);
    }

    private static int parseStat(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        String trimmed = value.trim();
        int sign = 1;
        int start = 0;
        if (trimmed.charAt(0) == '-') {
            sign = -1;
            start = 1;
        } else if (trimmed.charAt(0) == '+') {
            start = 1;
        }
        int result = 0;
        boolean sawDigit = false;
        for (int i = start; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (!Character.isDigit(c)) {
                break;
            }
            sawDigit = true;
            result = result * 10 + (c - '0');
        }
        // "*" and similar characteristic-defining values read as 0
        return sawDigit ? sign * result : 0;
    }

    @Override
    public String toString() {
        return name;
    }
}
