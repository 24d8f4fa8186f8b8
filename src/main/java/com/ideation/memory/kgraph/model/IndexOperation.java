package com.ideation.memory.kgraph.model;

/**
 * Calls the embedding peer understands.
 */
public enum IndexOperation {
    EMBED_NODES,
    EMBED_EDGES,
    DELETE,
    RESET
}
