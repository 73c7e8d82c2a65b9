package com.mtg.sim.card;

/**
 * The card database could not be loaded, or a lookup named a card it does not have.
 */
public class CardDatabaseException extends Exception {
    public CardDatabaseException(String message) {
        super(message);
    }

    public CardDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
