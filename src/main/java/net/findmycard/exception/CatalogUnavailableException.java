package net.findmycard.exception;

/**
 * The printing repository could not be enumerated, so no catalog snapshot can be served.
 * RETRYABLE: No (at request level; the next catalog reload may succeed)
 */
public class CatalogUnavailableException extends RuntimeException {
    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
