package com.ideation.memory.kgraph.scheduler;

import com.ideation.memory.kgraph.service.embedding.EmbeddingOutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically re-sends propagations the embedding peer missed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EmbeddingOutboxReplayScheduler {

    private final EmbeddingOutboxService outboxService;

    @Scheduled(fixedDelayString = "${kgraph.embedding.outbox.replay-interval-ms:30000}")
    public void replayOutbox() {
        log.debug("Running embedding outbox replay...");
        try {
            int delivered = outboxService.replayPending();
            if (delivered > 0) {
                log.info("Embedding outbox replay completed: {} propagations delivered", delivered);
            }
        } catch (Exception e) {
            log.error("Embedding outbox replay failed: {}", e.getMessage(), e);
        }
    }
}
