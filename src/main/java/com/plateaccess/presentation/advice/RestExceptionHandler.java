package com.plateaccess.presentation.advice;

import com.plateaccess.domain.exception.PersistenceFailureException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Traduce las excepciones a respuestas HTTP. Un fallo de almacenamiento siempre
 * es 503 con un mensaje distinto al de "sin coincidencia".
 */
@RestControllerAdvice
@Slf4j
public class RestExceptionHandler {

    static final String SUBSYSTEM_FAILURE = "Verification subsystem failure";

    @ExceptionHandler(PersistenceFailureException.class)
    public ResponseEntity<ErrorResponse> handlePersistenceFailure(PersistenceFailureException exception,
            HttpServletRequest request) {
        log.error("Fallo de persistencia en {}: {}", request.getRequestURI(), exception.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, SUBSYSTEM_FAILURE + ": " + exception.getMessage(), request);
    }

    @ExceptionHandler({ DataAccessException.class, TransactionException.class })
    public ResponseEntity<ErrorResponse> handleStorageException(RuntimeException exception,
            HttpServletRequest request) {
        log.error("Error de almacenamiento en {}: {}", request.getRequestURI(), exception.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, SUBSYSTEM_FAILURE + ": storage error", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException exception,
            HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, exception.getMessage(), request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(), message,
                request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
