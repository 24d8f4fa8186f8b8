package com.ideation.memory.kgraph.repository;

import java.util.Collection;

/**
 * Field-level writes to chat messages. The messages collection belongs to the messaging
 * subsystem, so documents are never replaced; only the curated flag of a candidate is set.
 */
public interface CandidateCurationRepository {

    /**
     * Flag the given scratch nodes of one message as curated.
     *
     * @param messageId the message document's {@code _id}
     * @return number of candidates modified
     */
    long markCurated(String messageId, Collection<String> candidateIds);
}
