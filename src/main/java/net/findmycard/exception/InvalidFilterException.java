package net.findmycard.exception;

/**
 * Filter input was malformed, named an unknown facet value, or described an empty range.
 * RETRYABLE: No
 */
public class InvalidFilterException extends RuntimeException {

    private final String facet;

    public InvalidFilterException(String facet, String message) {
        super(message);
        this.facet = facet;
    }

    public InvalidFilterException(String facet, String message, Throwable cause) {
        super(message, cause);
        this.facet = facet;
    }

    public String getFacet() {
        return facet;
    }
}
