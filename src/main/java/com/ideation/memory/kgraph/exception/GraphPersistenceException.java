package com.ideation.memory.kgraph.exception;

/**
 * The document store did not commit a graph change. Unlike peer failures
 * this aborts the operation, since the primary data is not durable.
 */
public class GraphPersistenceException extends RuntimeException {

    public GraphPersistenceException(String message) {
        super(message);
    }

    public GraphPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
