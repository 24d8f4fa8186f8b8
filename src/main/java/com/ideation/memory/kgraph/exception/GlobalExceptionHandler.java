package com.ideation.memory.kgraph.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

/**
 * Maps graph failures onto HTTP responses. Peer failures raised while propagating
 * a mutation never get here; only a layout request surfaces them.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GraphElementNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(GraphElementNotFoundException e) {
        log.warn("Graph element not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(InvalidGraphRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidGraphRequestException e) {
        log.warn("Invalid graph request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return build(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        return build(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(EmbeddingPeerException.class)
    public ResponseEntity<ErrorResponse> handlePeerFailure(EmbeddingPeerException e) {
        log.error("Embedding peer call '{}' failed: {}", e.getOperation(), e.describe());
        return build(HttpStatus.BAD_GATEWAY, "Embedding service unavailable: " + e.getMessage());
    }

    @ExceptionHandler(GraphPersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistenceFailure(GraphPersistenceException e) {
        log.error("Graph persistence failed: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .timestamp(LocalDateTime.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
