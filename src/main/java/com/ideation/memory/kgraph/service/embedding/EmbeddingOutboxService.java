package com.ideation.memory.kgraph.service.embedding;

import com.ideation.memory.kgraph.exception.EmbeddingPeerException;
import com.ideation.memory.kgraph.model.EmbeddingOutboxEntry;
import com.ideation.memory.kgraph.model.IndexCommand;
import com.ideation.memory.kgraph.repository.EmbeddingOutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Durable queue of propagations the embedding peer has not acknowledged.
 *
 * Ordering: entries of one user are replayed strictly oldest first. When an entry of a user fails,
 * the rest of that user's entries wait for the next pass. Entries that keep failing are parked as
 * FAILED after the configured number of attempts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingOutboxService {

    // createdAt is stored to the millisecond; ObjectId order breaks ties between entries of the same instant
    static final Sort REPLAY_ORDER = Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("id"));

    private final EmbeddingOutboxRepository outboxRepository;
    private final EmbeddingPeerClient peerClient;

    @Value("${kgraph.embedding.outbox.max-attempts:10}")
    private int maxAttempts = 10;

    @Value("${kgraph.embedding.outbox.batch-size:100}")
    private int batchSize = 100;

    public void enqueue(IndexCommand command, String reason) {
        EmbeddingOutboxEntry entry = EmbeddingOutboxEntry.builder()
                .userId(command.getUserId())
                .command(command)
                .status(EmbeddingOutboxEntry.Status.PENDING)
                .attempts(0)
                .lastError(reason)
                .createdAt(LocalDateTime.now())
                .build();

        outboxRepository.save(entry);
        log.info("[Embedding Outbox] Queued {} ({} items) for user {}",
                command.getOperation(), command.size(), command.getUserId());
    }

    public boolean hasPending(String userId) {
        return outboxRepository.existsByUserIdAndStatus(userId, EmbeddingOutboxEntry.Status.PENDING);
    }

    /**
     * Drop queued propagations of a user whose index is about to be reset.
     */
    public long discardPending(String userId) {
        long discarded = outboxRepository.deleteByUserIdAndStatus(userId, EmbeddingOutboxEntry.Status.PENDING);
        if (discarded > 0) {
            log.info("[Embedding Outbox] Discarded {} pending entries for user {}", discarded, userId);
        }
        return discarded;
    }

    /**
     * Re-send pending entries, oldest first.
     *
     * @return number of entries the peer acknowledged
     */
    public int replayPending() {
        List<EmbeddingOutboxEntry> pending = outboxRepository.findByStatus(
                EmbeddingOutboxEntry.Status.PENDING, PageRequest.of(0, batchSize, REPLAY_ORDER));
        if (pending.isEmpty()) {
            return 0;
        }

        Set<String> blockedUsers = new HashSet<>();
        int delivered = 0;

        for (EmbeddingOutboxEntry entry : pending) {
            if (blockedUsers.contains(entry.getUserId())) {
                continue;
            }

            try {
                peerClient.execute(entry.getCommand(), null);
                outboxRepository.delete(entry);
                delivered++;
                log.info("[Embedding Outbox] Replayed {} for user {} after {} failed attempts",
                        entry.getCommand().getOperation(), entry.getUserId(), entry.getAttempts());
            } catch (EmbeddingPeerException e) {
                recordFailure(entry, e);
                blockedUsers.add(entry.getUserId());
            }
        }

        return delivered;
    }

    private void recordFailure(EmbeddingOutboxEntry entry, EmbeddingPeerException e) {
        entry.setAttempts(entry.getAttempts() + 1);
        entry.setLastError(e.describe());
        entry.setLastAttemptAt(LocalDateTime.now());

        if (entry.getAttempts() >= maxAttempts) {
            entry.setStatus(EmbeddingOutboxEntry.Status.FAILED);
            log.error("[Embedding Outbox] Giving up on {} for user {} after {} attempts: {}",
                    entry.getCommand().getOperation(), entry.getUserId(), entry.getAttempts(), e.describe());
        } else {
            log.warn("[Embedding Outbox] Replay of {} for user {} failed (attempt {}/{}): {}",
                    entry.getCommand().getOperation(), entry.getUserId(), entry.getAttempts(), maxAttempts,
                    e.describe());
        }
        outboxRepository.save(entry);
    }
}
