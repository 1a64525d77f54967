package org.example.authcore.controller;

import lombok.extern.slf4j.Slf4j;
import org.example.authcore.dto.response.MessageResponse;
import org.example.authcore.exception.*;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps each core failure kind to a status code. Token failures share one message
 * so the response does not reveal which check failed.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<MessageResponse> handleNotFound(AccountNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(AlreadyActiveException.class)
    public ResponseEntity<MessageResponse> handleAlreadyActive(AlreadyActiveException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    // Concurrent registrations for one email can both pass the lookup; the unique constraint decides.
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<MessageResponse> handleDuplicate(DataIntegrityViolationException e) {
        log.info("Rejected conflicting write: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "An account with that email already exists");
    }

    @ExceptionHandler({InvalidTokenException.class, MalformedClaimException.class})
    public ResponseEntity<MessageResponse> handleInvalidToken(AuthCoreException e) {
        log.debug("Token rejected: {}", e.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "Invalid token");
    }

    @ExceptionHandler(ExpiredTokenException.class)
    public ResponseEntity<MessageResponse> handleExpired(ExpiredTokenException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({InactiveAccountException.class, AuthenticationFailedException.class})
    public ResponseEntity<MessageResponse> handleBadCredentials(AuthCoreException e) {
        log.debug("Credentials rejected: {}", e.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, AuthController.INVALID_CREDENTIALS);
    }

    @ExceptionHandler(NotificationException.class)
    public ResponseEntity<MessageResponse> handleNotification(NotificationException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Activation email could not be sent, please register again");
    }

    @ExceptionHandler({SigningException.class, KeyLoadException.class})
    public ResponseEntity<MessageResponse> handleSigning(AuthCoreException e) {
        log.error("Credential signing failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<MessageResponse> handleValidation(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "Invalid request";
        return respond(HttpStatus.BAD_REQUEST, message);
    }

    private static ResponseEntity<MessageResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new MessageResponse(message));
    }
}
