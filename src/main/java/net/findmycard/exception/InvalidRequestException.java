package net.findmycard.exception;

/**
 * Client input failed validation: a missing source card, a non-positive limit, or an admin
 * payload that is not a usable card array.
 * RETRYABLE: No
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
