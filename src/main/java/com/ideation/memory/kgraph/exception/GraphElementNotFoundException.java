package com.ideation.memory.kgraph.exception;

/**
 * A node, edge or import candidate does not exist in the caller's graph.
 */
public class GraphElementNotFoundException extends RuntimeException {

    public GraphElementNotFoundException(String message) {
        super(message);
    }
}
