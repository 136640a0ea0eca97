package net.findmycard.controller.support;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.findmycard.exception.CardNotFoundException;
import net.findmycard.exception.CatalogUnavailableException;
import net.findmycard.exception.InvalidFilterException;
import net.findmycard.exception.InvalidRequestException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps domain failures to HTTP statuses for every API controller, including errors
 * emitted by {@code Mono} return values after async dispatch.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(CardNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(CardNotFoundException ex) {
        log.debug("Card lookup miss: {}", ex.getReference());
        return ErrorResponseUtils.notFound(ex.getMessage());
    }

    @ExceptionHandler(InvalidFilterException.class)
    public ResponseEntity<Map<String, String>> handleInvalidFilter(InvalidFilterException ex) {
        log.debug("Rejected filter facet {}: {}", ex.getFacet(), ex.getMessage());
        return ErrorResponseUtils.badRequest(ex.getMessage());
    }

    @ExceptionHandler({
        InvalidRequestException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        log.debug("Bad request: {}", ex.getMessage());
        return ErrorResponseUtils.badRequest(ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleUnexpectedArgument(IllegalArgumentException ex) {
        // not client input: validated input arrives as InvalidRequestException or InvalidFilterException
        log.error("Unexpected invalid argument while serving request: {}", ex.getMessage(), ex);
        return ErrorResponseUtils.error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");
    }

    @ExceptionHandler(CatalogUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleCatalogUnavailable(CatalogUnavailableException ex) {
        log.error("Card catalog unavailable: {}", ex.getMessage(), ex);
        return ErrorResponseUtils.serviceUnavailable(ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return ErrorResponseUtils.error(status, ex.getReason());
    }
}
