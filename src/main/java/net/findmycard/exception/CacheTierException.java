package net.findmycard.exception;

/**
 * A cache tier could not serve or store an entry. Always handled by the cache
 * coordinator as a miss and never surfaced to request handlers.
 * RETRYABLE: Yes (transient)
 */
public class CacheTierException extends RuntimeException {

    private final String tier;

    public CacheTierException(String tier, String message, Throwable cause) {
        super("[" + tier + "] " + message, cause);
        this.tier = tier;
    }

    public String getTier() {
        return tier;
    }
}
