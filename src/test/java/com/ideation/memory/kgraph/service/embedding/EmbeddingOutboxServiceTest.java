package com.ideation.memory.kgraph.service.embedding;

import com.ideation.memory.kgraph.exception.EmbeddingPeerException;
import com.ideation.memory.kgraph.model.EmbeddingOutboxEntry;
import com.ideation.memory.kgraph.model.IndexCommand;
import com.ideation.memory.kgraph.repository.EmbeddingOutboxRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingOutboxServiceTest {

    @Mock
    private EmbeddingOutboxRepository outboxRepository;

    @Mock
    private EmbeddingPeerClient peerClient;

    @InjectMocks
    private EmbeddingOutboxService outboxService;

    @Test
    void enqueue_storesPendingEntryWithReason() {
        outboxService.enqueue(IndexCommand.delete("user-1", List.of("n1")), "status=503");

        ArgumentCaptor<EmbeddingOutboxEntry> saved = ArgumentCaptor.forClass(EmbeddingOutboxEntry.class);
        verify(outboxRepository).save(saved.capture());
        assertThat(saved.getValue().getUserId()).isEqualTo("user-1");
        assertThat(saved.getValue().getStatus()).isEqualTo(EmbeddingOutboxEntry.Status.PENDING);
        assertThat(saved.getValue().getAttempts()).isZero();
        assertThat(saved.getValue().getLastError()).isEqualTo("status=503");
    }

    @Test
    void replayPending_deliversAndRemovesAcknowledgedEntries() {
        EmbeddingOutboxEntry first = entry("e1", "user-1", IndexCommand.delete("user-1", List.of("n1")), 0);
        EmbeddingOutboxEntry second = entry("e2", "user-2", IndexCommand.reset("user-2"), 2);
        when(outboxRepository.findByStatus(eq(EmbeddingOutboxEntry.Status.PENDING), any(Pageable.class)))
                .thenReturn(List.of(first, second));

        int delivered = outboxService.replayPending();

        assertThat(delivered).isEqualTo(2);
        verify(peerClient).execute(first.getCommand(), null);
        verify(peerClient).execute(second.getCommand(), null);
        verify(outboxRepository).delete(first);
        verify(outboxRepository).delete(second);
    }

    @Test
    void replayPending_failureBlocksLaterEntriesOfSameUserOnly() {
        IndexCommand failing = IndexCommand.delete("user-1", List.of("n1"));
        IndexCommand blocked = IndexCommand.reset("user-1");
        IndexCommand other = IndexCommand.reset("user-2");
        EmbeddingOutboxEntry first = entry("e1", "user-1", failing, 0);
        EmbeddingOutboxEntry second = entry("e2", "user-1", blocked, 0);
        EmbeddingOutboxEntry third = entry("e3", "user-2", other, 0);
        when(outboxRepository.findByStatus(eq(EmbeddingOutboxEntry.Status.PENDING), any(Pageable.class)))
                .thenReturn(List.of(first, second, third));
        doThrow(new EmbeddingPeerException("delete", 500, "boom", "Internal Server Error", null))
                .when(peerClient).execute(eq(failing), isNull());

        int delivered = outboxService.replayPending();

        assertThat(delivered).isEqualTo(1);
        verify(peerClient, never()).execute(eq(blocked), any());
        verify(outboxRepository).delete(third);
        verify(outboxRepository).save(first);
        assertThat(first.getAttempts()).isEqualTo(1);
        assertThat(first.getStatus()).isEqualTo(EmbeddingOutboxEntry.Status.PENDING);
        assertThat(first.getLastError()).contains("status=500");
        assertThat(first.getLastAttemptAt()).isNotNull();
    }

    @Test
    void replayPending_readsOldestFirstWithIdAsTieBreak() {
        when(outboxRepository.findByStatus(eq(EmbeddingOutboxEntry.Status.PENDING), any(Pageable.class)))
                .thenReturn(List.of());

        outboxService.replayPending();

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(outboxRepository).findByStatus(eq(EmbeddingOutboxEntry.Status.PENDING), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(100);
        assertThat(page.getValue().getSort()).containsExactly(
                Sort.Order.asc("createdAt"), Sort.Order.asc("id"));
        verifyNoInteractions(peerClient);
    }

    @Test
    void replayPending_parksEntryAfterMaxAttempts() {
        IndexCommand command = IndexCommand.reset("user-1");
        EmbeddingOutboxEntry entry = entry("e1", "user-1", command, 9);
        when(outboxRepository.findByStatus(eq(EmbeddingOutboxEntry.Status.PENDING), any(Pageable.class)))
                .thenReturn(List.of(entry));
        doThrow(new EmbeddingPeerException("reset", null, null, "Connection refused", null))
                .when(peerClient).execute(command, null);

        assertThat(outboxService.replayPending()).isZero();

        assertThat(entry.getAttempts()).isEqualTo(10);
        assertThat(entry.getStatus()).isEqualTo(EmbeddingOutboxEntry.Status.FAILED);
        verify(outboxRepository).save(entry);
    }

    @Test
    void discardPending_deletesOnlyPendingEntriesOfUser() {
        when(outboxRepository.deleteByUserIdAndStatus("user-1", EmbeddingOutboxEntry.Status.PENDING)).thenReturn(3L);

        assertThat(outboxService.discardPending("user-1")).isEqualTo(3);
    }

    private static EmbeddingOutboxEntry entry(String id, String userId, IndexCommand command, int attempts) {
        return EmbeddingOutboxEntry.builder()
                .id(id)
                .userId(userId)
                .command(command)
                .status(EmbeddingOutboxEntry.Status.PENDING)
                .attempts(attempts)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
