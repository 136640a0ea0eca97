package net.findmycard.exception;

/**
 * A card reference matched no printing, oracle id or derived key in the current catalog.
 * RETRYABLE: No
 */
public class CardNotFoundException extends RuntimeException {

    private final String reference;

    public CardNotFoundException(String reference) {
        super("No card found for reference '" + reference + "'");
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
