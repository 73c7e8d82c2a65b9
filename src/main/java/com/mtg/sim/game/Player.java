package com.mtg.sim.game;

import com.mtg.sim.card.Card;
import com.mtg.sim.game.zones.Battlefield;
import com.mtg.sim.game.zones.Exile;
import com.mtg.sim.game.zones.Graveyard;
import com.mtg.sim.game.zones.Hand;
import com.mtg.sim.game.zones.Library;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A player and the zones they own. Opponents are referenced by seat.
 */
public class Player {
    private final String name;
    private final int seat;
    private final Library library;
    private final Hand hand = new Hand();
    private final Graveyard graveyard = new Graveyard();
    private final Exile exile = new Exile();
    private final Battlefield battlefield = new Battlefield();
    private final ManaPool manaPool = new ManaPool();
    private final List<Integer> opponentSeats = new ArrayList<>(1);

    private int life;
    private int landsPlayedThisTurn;
    private boolean drewFromEmptyLibrary;
    private boolean lost;

    public Player(String name, int seat, int startingLife, List<Card> deck) {
        this.name = name;
        this.seat = seat;
        this.life = startingLife;
        this.library = new Library(deck);
    }

    public String getName() {
        return name;
    }

    public int getSeat() {
        return seat;
    }

    public int getLife() {
        return life;
    }

    public void gainLife(int amount) {
        life += amount;
    }

    /**
     * Lose life; the total may go negative.
     */
    public void loseLife(int amount) {
        life -= amount;
    }

    public Library getLibrary() {
        return library;
    }

    public Hand getHand() {
        return hand;
    }

    public Graveyard getGraveyard() {
        return graveyard;
    }

    public Exile getExile() {
        return exile;
    }

    public Battlefield getBattlefield() {
        return battlefield;
    }

    public ManaPool getManaPool() {
        return manaPool;
    }

    public List<Integer> getOpponentSeats() {
        return List.copyOf(opponentSeats);
    }

    void addOpponentSeat(int opponentSeat) {
        opponentSeats.add(opponentSeat);
    }

    /**
     * Draw the top card into hand. Drawing from an empty library flags the
     * player for the state-based loss check instead of failing.
     */
    public Optional<Card> drawCard() {
        Optional<Card> card = library.draw();
        if (card.isEmpty()) {
            drewFromEmptyLibrary = true;
            return card;
        }
        hand.add(card.get());
        return card;
    }

    public int drawCards(int count) {
        int drawn = 0;
        for (int i = 0; i < count; i++) {
            if (drawCard().isPresent()) {
                drawn++;
            }
        }
        return drawn;
    }

    /**
     * Move a card from hand to graveyard.
     * @return false if the card was not in hand
     */
    public boolean discard(Card card) {
        if (!hand.remove(card)) {
            return false;
        }
        graveyard.add(card);
        return true;
    }

    public int getLandsPlayedThisTurn() {
        return landsPlayedThisTurn;
    }

    void recordLandPlayed() {
        landsPlayedThisTurn++;
    }

    void resetTurnState() {
        landsPlayedThisTurn = 0;
    }

    public boolean hasDrawnFromEmptyLibrary() {
        return drewFromEmptyLibrary;
    }

    public boolean hasLost() {
        return lost;
    }

    void markLost() {
        lost = true;
    }

    @Override
    public String toString() {
        return name + " (seat " + seat + ", " + life + " life)";
    }
}
