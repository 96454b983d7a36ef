package edu.harvard.hms.dbmi.avillach.inventory.service.util;

import edu.harvard.hms.dbmi.avillach.inventory.exception.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.NoSuchElementException;

/**
 * Maps operation-level failures to HTTP statuses with a {@code {error, message}} body.
 */
@RestControllerAdvice
public class InventoryExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(InventoryExceptionHandler.class);

    @ExceptionHandler(InventoryException.class)
    public ResponseEntity<ErrorResponse> handleInventoryException(InventoryException e) {
        HttpStatus status;
        if (e instanceof SchemaConflictException || e instanceof QueryCancelledException) {
            status = HttpStatus.CONFLICT;
        } else if (e instanceof UnknownVersionException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof InvalidPredicateException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof LockTimeoutException) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        log.warn("{} ({}): {}", e.getCode(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.getCode(), e.getMessage()));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoSuchElementException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("NotFound", e.getMessage()));
    }

    @ExceptionHandler({ IllegalArgumentException.class, MissingServletRequestParameterException.class, MissingServletRequestPartException.class })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BadRequest", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse("Conflict", e.getMessage()));
    }
}
