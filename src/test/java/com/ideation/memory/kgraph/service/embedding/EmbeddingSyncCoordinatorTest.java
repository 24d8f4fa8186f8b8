package com.ideation.memory.kgraph.service.embedding;

import com.ideation.memory.kgraph.dto.embedding.NodeEmbedding;
import com.ideation.memory.kgraph.exception.EmbeddingPeerException;
import com.ideation.memory.kgraph.model.IndexCommand;
import com.ideation.memory.kgraph.model.IndexOperation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingSyncCoordinatorTest {

    private static final String USER = "user-1";
    private static final List<NodeEmbedding> NODES =
            List.of(NodeEmbedding.builder().id("n1").content("idea").build());

    @Mock
    private EmbeddingPeerClient peerClient;

    @Mock
    private EmbeddingOutboxService outboxService;

    @InjectMocks
    private EmbeddingSyncCoordinator coordinator;

    @Test
    void embedNodes_sendsDirectlyWhenNothingIsQueued() {
        when(outboxService.hasPending(USER)).thenReturn(false);

        boolean acknowledged = coordinator.embedNodes(USER, NODES, "Bearer caller");

        assertThat(acknowledged).isTrue();
        ArgumentCaptor<IndexCommand> command = ArgumentCaptor.forClass(IndexCommand.class);
        verify(peerClient).execute(command.capture(), eq("Bearer caller"));
        assertThat(command.getValue().getOperation()).isEqualTo(IndexOperation.EMBED_NODES);
        assertThat(command.getValue().getNodes()).isEqualTo(NODES);
        verify(outboxService, never()).enqueue(any(), anyString());
    }

    @Test
    void embedNodes_defersToOutboxWhenPeerFails() {
        when(outboxService.hasPending(USER)).thenReturn(false);
        doThrow(new EmbeddingPeerException("embed_node", 503, "busy", "Service Unavailable", null))
                .when(peerClient).execute(any(IndexCommand.class), any());

        boolean acknowledged = coordinator.embedNodes(USER, NODES, null);

        assertThat(acknowledged).isFalse();
        ArgumentCaptor<String> reason = ArgumentCaptor.forClass(String.class);
        verify(outboxService).enqueue(any(IndexCommand.class), reason.capture());
        assertThat(reason.getValue()).contains("status=503").contains("busy");
    }

    @Test
    void embedNodes_queuesBehindPendingEntriesOfSameUser() {
        when(outboxService.hasPending(USER)).thenReturn(true);

        boolean acknowledged = coordinator.embedNodes(USER, NODES, null);

        assertThat(acknowledged).isFalse();
        verify(outboxService).enqueue(any(IndexCommand.class), anyString());
        verifyNoInteractions(peerClient);
    }

    @Test
    void embedNodes_peerFailureWithBrokenOutboxIsStillNotEscalated() {
        when(outboxService.hasPending(USER)).thenReturn(false);
        doThrow(new EmbeddingPeerException("embed_node", null, null, "Connection refused", null))
                .when(peerClient).execute(any(IndexCommand.class), any());
        doThrow(new DataAccessResourceFailureException("mongo down"))
                .when(outboxService).enqueue(any(IndexCommand.class), anyString());

        assertThat(coordinator.embedNodes(USER, NODES, null)).isFalse();
    }

    @Test
    void emptyBatchesAreNoOps() {
        assertThat(coordinator.embedNodes(USER, List.of(), null)).isTrue();
        assertThat(coordinator.embedEdges(USER, List.of(), null)).isTrue();
        assertThat(coordinator.delete(USER, List.of(), null)).isTrue();
        verifyNoInteractions(peerClient, outboxService);
    }

    @Test
    void reset_discardsQueuedEntriesBeforeSending() {
        when(outboxService.hasPending(USER)).thenReturn(false);

        assertThat(coordinator.reset(USER, "Bearer caller")).isTrue();

        InOrder order = inOrder(outboxService, peerClient);
        order.verify(outboxService).discardPending(USER);
        order.verify(peerClient).execute(any(IndexCommand.class), eq("Bearer caller"));
    }
}
