package com.mischwald.scorer.card;

/**
 * Exception thrown by CardDatabase operations.
 * A card file that cannot be loaded is a setup error, not a scoring outcome.
 */
public class CardDatabaseException extends Exception {
    public CardDatabaseException(String message) {
        super(message);
    }

    public CardDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
