package com.mtg.sim.game;

import com.mtg.sim.ability.AbilityParser;
import com.mtg.sim.ability.TriggerCondition;
import com.mtg.sim.card.Card;
import com.mtg.sim.card.CardDatabase;
import com.mtg.sim.card.Keyword;
import com.mtg.sim.game.combat.CombatResolver;
import com.mtg.sim.game.zones.Permanent;
import com.mtg.sim.rng.GameRng;
import com.mtg.sim.simulation.Deck;
import com.mtg.sim.simulation.SimpleStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One two-player game. All state lives here, so games share nothing but the
 * read-only card database and parser.
 */
public class Game {
    private static final Logger log = LoggerFactory.getLogger(Game.class);
    private static final int PLAYER_COUNT = 2;

    private final CardDatabase cardDatabase;
    private final AbilityParser abilityParser;
    private final GameConfig config;
    private final GameRng rng;

    private final List<Player> players = new ArrayList<>(PLAYER_COUNT);
    private final Map<Integer, PlayerStrategy> strategies = new HashMap<>();
    private final PriorityStack stack = new PriorityStack();
    private final PriorityManager priorityManager = new PriorityManager(stack, PLAYER_COUNT);
    private final TargetValidator targetValidator = new TargetValidator(this);
    private final StateBasedActionChecker stateBasedActions = new StateBasedActionChecker();
    private final SpellCastingEngine spellCastingEngine;
    private final CombatResolver combatResolver;

    private long nextPermanentId = 1;
    private long nextStackItemId = 1;
    private int turnNumber;
    private int activeSeat;
    private Step currentStep = Step.UNTAP;
    private boolean started;

    public Game(CardDatabase cardDatabase, AbilityParser abilityParser, GameConfig config, GameRng rng) {
        this.cardDatabase = cardDatabase;
        this.abilityParser = abilityParser;
        this.config = config;
        this.rng = rng;
        this.spellCastingEngine = new SpellCastingEngine(this);
        this.combatResolver = new CombatResolver(this);
    }

    public Game(CardDatabase cardDatabase, AbilityParser abilityParser, GameConfig config) {
        this(cardDatabase, abilityParser, config, new GameRng());
    }

    // ---- Setup ----

    /**
     * Add a player whose library is the deck's main deck.
     * @throws IllegalStateException if two players are already seated or the game started
     */
    public Player addPlayer(Deck deck) {
        return addPlayer(deck.getName(), deck.getCards());
    }

    /**
     * Import a deck file and add its player.
     * @throws Deck.DeckException if the deck cannot be read or names unknown cards
     */
    public Player addPlayer(Path deckFile) throws Deck.DeckException {
        return addPlayer(Deck.loadFromFile(deckFile.toString(), cardDatabase));
    }

    public Player addPlayer(String name, List<Card> library) {
        if (started) {
            throw new IllegalStateException("Cannot add players after the game started");
        }
        if (players.size() >= PLAYER_COUNT) {
            throw new IllegalStateException("A game has exactly " + PLAYER_COUNT + " players");
        }
        String uniqueName = name;
        for (Player existing : players) {
            if (existing.getName().equals(name)) {
                uniqueName = name + " (2)";
            }
        }
        Player player = new Player(uniqueName, players.size(), config.startingLife(), library);
        for (Player existing : players) {
            existing.addOpponentSeat(player.getSeat());
            player.addOpponentSeat(existing.getSeat());
        }
        players.add(player);
        strategies.put(player.getSeat(), new SimpleStrategy());
        return player;
    }

    public void setStrategy(Player player, PlayerStrategy strategy) {
        strategies.put(player.getSeat(), strategy);
    }

    public PlayerStrategy getStrategy(int seat) {
        return strategies.get(seat);
    }

    // ---- Running ----

    /**
     * Play the game to completion or until the turn budget runs out.
     * @throws IllegalStateException if there are not two players or the game already ran
     */
    public GameResult start() {
        if (players.size() != PLAYER_COUNT) {
            throw new IllegalStateException("Need " + PLAYER_COUNT + " players, have " + players.size());
        }
        if (started) {
            throw new IllegalStateException("Game already started");
        }
        started = true;

        for (Player player : players) {
            player.getLibrary().shuffle(rng);
            player.drawCards(config.openingHandSize());
        }
        int firstSeat = rng.coinFlip() ? 0 : 1;
        log.info("Game start: {} vs {}, {} on the play",
                players.get(0).getName(), players.get(1).getName(), players.get(firstSeat).getName());

        TurnDriver driver = new TurnDriver(this);
        for (int turn = 1; turn <= config.maxTurns(); turn++) {
            turnNumber = turn;
            Player active = players.get((firstSeat + turn - 1) % PLAYER_COUNT);
            driver.playTurn(new TurnContext(turn, active, getOpponent(active), turn == 1));
            if (isOver()) {
                return buildResult(turn);
            }
        }
        log.info("No result after {} turns", config.maxTurns());
        return GameResult.noResult(config.maxTurns(), playerNames());
    }

    private GameResult buildResult(int turns) {
        List<Player> remaining = new ArrayList<>(1);
        Player loser = null;
        for (Player player : players) {
            if (player.hasLost()) {
                loser = player;
            } else {
                remaining.add(player);
            }
        }
        if (remaining.size() != 1 || loser == null) {
            log.info("Game drawn on turn {}", turns);
            return GameResult.draw(turns, playerNames());
        }
        Player winner = remaining.get(0);
        log.info("{} wins on turn {} ({} life)", winner.getName(), turns, winner.getLife());
        return GameResult.win(winner.getName(), loser.getName(), turns, playerNames());
    }

    private List<String> playerNames() {
        List<String> names = new ArrayList<>(PLAYER_COUNT);
        for (Player player : players) {
            names.add(player.getName());
        }
        return names;
    }

    public boolean isOver() {
        int alive = 0;
        for (Player player : players) {
            if (!player.hasLost()) {
                alive++;
            }
        }
        return players.size() == PLAYER_COUNT && alive <= 1;
    }

    /**
     * Move the game into a step of the given player's turn; the active player receives priority.
     */
    public void enterStep(Player active, Step step) {
        this.activeSeat = active.getSeat();
        this.currentStep = step;
        priorityManager.beginStep(activeSeat);
        log.trace("Turn {} {}: {}", turnNumber, active.getName(), step);
    }

    // ---- Zone changes ----

    /**
     * Create a permanent for a card under its owner's control.
     */
    public Permanent putOntoBattlefield(Card card, Player owner) {
        Permanent permanent = new Permanent(nextPermanentId++, card, owner.getSeat(),
                abilityParser.parseAbilities(card), turnNumber);
        owner.getBattlefield().add(permanent);
        log.debug("{} enters the battlefield under {}", permanent, owner.getName());
        return permanent;
    }

    /**
     * Play a land from hand as the turn's land drop.
     * @throws IllegalTimingException if a land cannot be played now
     */
    public Permanent playLand(Player player, Card card) throws IllegalTimingException {
        if (!card.isLand()) {
            throw new IllegalArgumentException(card.getName() + " is not a land");
        }
        if (!player.getHand().contains(card)) {
            throw new IllegalArgumentException(card.getName() + " is not in " + player.getName() + "'s hand");
        }
        if (player.getLandsPlayedThisTurn() >= 1) {
            throw new IllegalTimingException(player.getName() + " already played a land this turn");
        }
        if (activeSeat != player.getSeat() || !currentStep.isMainPhase() || !stack.isEmpty()) {
            throw new IllegalTimingException("Lands can only be played in your main phase with an empty stack");
        }
        player.getHand().remove(card);
        player.recordLandPlayed();
        Permanent land = putOntoBattlefield(card, player);
        spellCastingEngine.fireTriggers(TriggerCondition.ENTERS_THE_BATTLEFIELD, land);
        return land;
    }

    /**
     * Destroy a permanent unless it is indestructible.
     * @return true if it went to the graveyard
     */
    public boolean destroy(Permanent permanent) {
        if (permanent.hasKeyword(Keyword.INDESTRUCTIBLE)) {
            log.debug("{} is indestructible", permanent.getName());
            return false;
        }
        if (findPermanent(permanent.getId()).isEmpty()) {
            return false;
        }
        movePermanentToGraveyard(permanent);
        log.debug("{} is destroyed", permanent.getName());
        return true;
    }

    /**
     * Move a permanent to its owner's graveyard and detach it from combat.
     * Attackers it was blocking stay blocked.
     */
    public void movePermanentToGraveyard(Permanent permanent) {
        Player owner = getPlayer(permanent.getOwnerSeat());
        if (owner.getBattlefield().remove(permanent.getId()).isEmpty()) {
            return;
        }
        Long blocking = permanent.getBlockingId();
        if (blocking != null) {
            findPermanent(blocking).ifPresent(attacker -> attacker.removeBlocker(permanent.getId()));
        }
        for (long blockerId : permanent.getBlockedByIds()) {
            findPermanent(blockerId).ifPresent(blocker -> blocker.setBlockingId(null));
        }
        permanent.clearCombatState();
        owner.getGraveyard().add(permanent.getCard());
    }

    /**
     * Run state-based actions and put resulting death triggers on the stack.
     */
    public SbaResult checkStateBasedActions() {
        SbaResult result = stateBasedActions.check(this);
        for (Permanent dead : result.died()) {
            spellCastingEngine.fireTriggers(TriggerCondition.DIES, dead);
        }
        return result;
    }

    // ---- Lookups ----

    public Optional<Permanent> findPermanent(long id) {
        for (Player player : players) {
            Optional<Permanent> found = player.getBattlefield().find(id);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public List<Player> getPlayers() {
        return List.copyOf(players);
    }

    public Player getPlayer(int seat) {
        return players.get(seat);
    }

    public Player getOpponent(Player player) {
        return players.get(player.getOpponentSeats().get(0));
    }

    public Player getActivePlayer() {
        return players.get(activeSeat);
    }

    public int getActiveSeat() {
        return activeSeat;
    }

    public Step getCurrentStep() {
        return currentStep;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    long nextStackItemId() {
        return nextStackItemId++;
    }

    public PriorityStack getStack() {
        return stack;
    }

    public PriorityManager getPriorityManager() {
        return priorityManager;
    }

    public SpellCastingEngine getSpellCastingEngine() {
        return spellCastingEngine;
    }

    public CombatResolver getCombatResolver() {
        return combatResolver;
    }

    public TargetValidator getTargetValidator() {
        return targetValidator;
    }

    public AbilityParser getAbilityParser() {
        return abilityParser;
    }

    public CardDatabase getCardDatabase() {
        return cardDatabase;
    }

    public GameConfig getConfig() {
        return config;
    }

    public GameRng getRng() {
        return rng;
    }
}
