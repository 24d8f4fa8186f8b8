package com.ideation.memory.kgraph.service.graph;

import com.ideation.memory.kgraph.exception.GraphPersistenceException;
import com.ideation.memory.kgraph.exception.InvalidGraphRequestException;
import com.ideation.memory.kgraph.model.GraphDocument;
import com.ideation.memory.kgraph.repository.GraphDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.function.Function;

/**
 * Read-modify-write access to a user's {@link GraphDocument}.
 *
 * Concurrent writers are serialized by the document's version field: a save that loses the race
 * is re-run against a fresh copy of the document. Mutations therefore must only touch the
 * document they are handed and be safe to run more than once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GraphDocumentMutator {

    private final GraphDocumentRepository graphDocumentRepository;

    @Value("${kgraph.graph.max-write-attempts:5}")
    private int maxWriteAttempts = 5;

    /**
     * Load the user's graph, creating an empty one on first access.
     */
    public GraphDocument getOrCreate(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidGraphRequestException("userId is required");
        }

        try {
            return graphDocumentRepository.findByUserId(userId)
                    .orElseGet(() -> create(userId));
        } catch (DataAccessException e) {
            throw new GraphPersistenceException("Failed to load graph for user " + userId, e);
        }
    }

    /**
     * Apply a mutation to the user's graph and commit it.
     *
     * @return whatever the mutation returned, once the document is saved
     */
    public <R> R mutate(String userId, Function<GraphDocument, R> mutation) {
        for (int attempt = 1; ; attempt++) {
            GraphDocument document = getOrCreate(userId);
            R result = mutation.apply(document);
            document.setUpdatedAt(LocalDateTime.now());

            try {
                graphDocumentRepository.save(document);
                return result;
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= maxWriteAttempts) {
                    throw new GraphPersistenceException(
                            "Graph of user " + userId + " kept changing concurrently, gave up after "
                                    + attempt + " attempts", e);
                }
                log.warn("[KGraph] Concurrent write on graph of user {}, retrying ({}/{})",
                        userId, attempt, maxWriteAttempts);
            } catch (DataAccessException e) {
                throw new GraphPersistenceException("Failed to save graph for user " + userId, e);
            }
        }
    }

    /**
     * @return true if a document existed and was removed
     */
    public boolean delete(String userId) {
        try {
            return graphDocumentRepository.deleteByUserId(userId) > 0;
        } catch (DataAccessException e) {
            throw new GraphPersistenceException("Failed to delete graph for user " + userId, e);
        }
    }

    private GraphDocument create(String userId) {
        try {
            GraphDocument created = graphDocumentRepository.save(GraphDocument.empty(userId));
            log.info("[KGraph] Created new graph (userId: {})", userId);
            return created;
        } catch (DuplicateKeyException e) {
            // Another request created it first
            return graphDocumentRepository.findByUserId(userId)
                    .orElseThrow(() -> new GraphPersistenceException("Graph of user " + userId + " vanished after creation", e));
        }
    }
}
