package com.ideation.memory.kgraph.exception;

import lombok.Getter;

/**
 * The embedding/clustering peer timed out, was unreachable or answered with an error status.
 */
@Getter
public class EmbeddingPeerException extends RuntimeException {

    private final String operation;
    private final Integer statusCode;       // null when no response was received
    private final String responseBody;

    public EmbeddingPeerException(String operation, Integer statusCode, String responseBody, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public String describe() {
        return String.format("status=%s body=%s message=%s",
                statusCode != null ? statusCode : "n/a",
                responseBody != null && !responseBody.isBlank() ? responseBody : "n/a",
                getMessage());
    }
}
