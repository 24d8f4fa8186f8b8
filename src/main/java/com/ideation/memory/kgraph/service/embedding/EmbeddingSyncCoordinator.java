package com.ideation.memory.kgraph.service.embedding;

import com.ideation.memory.kgraph.dto.embedding.EdgeEmbedding;
import com.ideation.memory.kgraph.dto.embedding.NodeEmbedding;
import com.ideation.memory.kgraph.exception.EmbeddingPeerException;
import com.ideation.memory.kgraph.model.IndexCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Propagates committed graph changes to the embedding peer.
 *
 * The graph document is authoritative and is never rolled back. A propagation the peer does not
 * acknowledge goes to the outbox and is replayed later. While a user has queued propagations,
 * new ones for that user are queued behind them so the peer sees changes in commit order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingSyncCoordinator implements IndexSynchronizer {

    private final EmbeddingPeerClient peerClient;
    private final EmbeddingOutboxService outboxService;

    @Override
    public boolean embedNodes(String userId, List<NodeEmbedding> nodes, String authorization) {
        if (nodes.isEmpty()) {
            return true;
        }
        return propagate(IndexCommand.embedNodes(userId, nodes), authorization);
    }

    @Override
    public boolean embedEdges(String userId, List<EdgeEmbedding> edges, String authorization) {
        if (edges.isEmpty()) {
            return true;
        }
        return propagate(IndexCommand.embedEdges(userId, edges), authorization);
    }

    @Override
    public boolean delete(String userId, List<String> ids, String authorization) {
        if (ids.isEmpty()) {
            return true;
        }
        return propagate(IndexCommand.delete(userId, ids), authorization);
    }

    /**
     * A reset supersedes anything still queued for the user.
     */
    @Override
    public boolean reset(String userId, String authorization) {
        try {
            outboxService.discardPending(userId);
        } catch (DataAccessException e) {
            log.error("[Embedding Sync] Could not discard queued propagations for user {}: {}",
                    userId, e.getMessage(), e);
        }
        return propagate(IndexCommand.reset(userId), authorization);
    }

    private boolean propagate(IndexCommand command, String authorization) {
        String userId = command.getUserId();

        try {
            if (outboxService.hasPending(userId)) {
                outboxService.enqueue(command, "queued behind pending propagations");
                return false;
            }
        } catch (DataAccessException e) {
            log.warn("[Embedding Sync] Outbox lookup failed for user {}, sending directly: {}", userId, e.getMessage());
        }

        try {
            peerClient.execute(command, authorization);
            log.info("[Embedding Sync] {} succeeded (userId: {}, items: {})",
                    command.getOperation(), userId, command.size());
            return true;
        } catch (EmbeddingPeerException e) {
            log.error("[Embedding Sync] {} failed (userId: {}, items: {}): {}",
                    command.getOperation(), userId, command.size(), e.describe());
            defer(command, e.describe());
            return false;
        }
    }

    private void defer(IndexCommand command, String reason) {
        try {
            outboxService.enqueue(command, reason);
        } catch (DataAccessException e) {
            // Document and index now diverge until the next full reset
            log.error("[Embedding Sync] Could not queue {} for user {}, change is lost for the index: {}",
                    command.getOperation(), command.getUserId(), e.getMessage(), e);
        }
    }
}
