package com.ideation.memory.kgraph.service.importer;

import com.ideation.memory.kgraph.dto.embedding.NodeEmbedding;
import com.ideation.memory.kgraph.dto.graph.NodeResponse;
import com.ideation.memory.kgraph.exception.GraphElementNotFoundException;
import com.ideation.memory.kgraph.exception.GraphPersistenceException;
import com.ideation.memory.kgraph.exception.InvalidGraphRequestException;
import com.ideation.memory.kgraph.model.CandidateNode;
import com.ideation.memory.kgraph.model.ConversationMessage;
import com.ideation.memory.kgraph.model.GraphDocument;
import com.ideation.memory.kgraph.repository.ConversationMessageRepository;
import com.ideation.memory.kgraph.repository.GraphDocumentRepository;
import com.ideation.memory.kgraph.service.embedding.IndexSynchronizer;
import com.ideation.memory.kgraph.service.graph.GraphDocumentMutator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImportCoordinatorTest {

    private static final String USER = "user-1";

    @Mock
    private ConversationMessageRepository messageRepository;

    @Mock
    private GraphDocumentRepository graphDocumentRepository;

    @Mock
    private IndexSynchronizer indexSynchronizer;

    @Captor
    private ArgumentCaptor<List<NodeEmbedding>> embedded;

    private GraphDocument graph;
    private ImportCoordinator importCoordinator;

    @BeforeEach
    void setUp() {
        graph = GraphDocument.empty(USER);
        lenient().when(graphDocumentRepository.findByUserId(USER)).thenReturn(Optional.of(graph));
        lenient().when(graphDocumentRepository.save(any(GraphDocument.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        importCoordinator = new ImportCoordinator(messageRepository,
                new GraphDocumentMutator(graphDocumentRepository), indexSynchronizer);
    }

    @Test
    void importNodes_promotesCandidatesWithProvenance() {
        CandidateNode withContent = candidate("c1", "Solar roofs", "energy", false);
        withContent.setX(12.0);
        CandidateNode labelOnly = candidate("c2", null, "storage", false);
        CandidateNode bare = candidate("c3", "", null, false);
        ConversationMessage message = message("msg-1", "conv-1", withContent, labelOnly, bare);
        List<String> ids = List.of("c1", "c2", "c3");
        when(messageRepository.findByUserIdAndCandidateIds(USER, ids)).thenReturn(List.of(message));

        List<NodeResponse> created = importCoordinator.importNodes(USER, ids, "Bearer caller");

        assertThat(created).extracting(NodeResponse::getContent)
                .containsExactly("Solar roofs", "storage", "New node");
        assertThat(created.get(0).getLabel()).containsExactly("energy");
        assertThat(created.get(0).getX()).isEqualTo(12.0);
        assertThat(created.get(2).getLabel()).isEmpty();
        assertThat(created).allSatisfy(node -> {
            assertThat(node.getSourceMessageId()).isEqualTo("msg-1");
            assertThat(node.getSourceConversationId()).isEqualTo("conv-1");
        });
        assertThat(graph.getNodes()).hasSize(3);

        verify(messageRepository).markCurated("doc-msg-1", List.of("c1", "c2", "c3"));
        verify(messageRepository, never()).saveAll(anyList());
        verify(messageRepository, never()).save(any(ConversationMessage.class));

        verify(indexSynchronizer).embedNodes(eq(USER), embedded.capture(), eq("Bearer caller"));
        assertThat(embedded.getValue()).hasSize(3);
    }

    @Test
    void importNodes_skipsAlreadyCuratedCandidates() {
        ConversationMessage message = message("msg-1", "conv-1",
                candidate("c1", "done before", null, true),
                candidate("c2", "fresh", null, false));
        when(messageRepository.findByUserIdAndCandidateIds(eq(USER), anyList())).thenReturn(List.of(message));

        List<NodeResponse> created = importCoordinator.importNodes(USER, List.of("c1", "c2"), null);

        assertThat(created).extracting(NodeResponse::getContent).containsExactly("fresh");
        assertThat(graph.getNodes()).hasSize(1);
        verify(messageRepository).markCurated("doc-msg-1", List.of("c2"));
    }

    @Test
    void importNodes_secondImportOfSameCandidateFindsNothing() {
        CandidateNode candidate = candidate("c1", "idea", null, false);
        ConversationMessage message = message("msg-1", "conv-1", candidate);
        when(messageRepository.findByUserIdAndCandidateIds(eq(USER), anyList())).thenReturn(List.of(message));
        when(messageRepository.markCurated(anyString(), anyCollection())).thenAnswer(invocation -> {
            candidate.setCurated(true);
            return 1L;
        });

        importCoordinator.importNodes(USER, List.of("c1"), null);

        assertThatThrownBy(() -> importCoordinator.importNodes(USER, List.of("c1"), null))
                .isInstanceOf(GraphElementNotFoundException.class);
        assertThat(graph.getNodes()).hasSize(1);
    }

    @Test
    void importNodes_marksCandidatesPerMessage() {
        ConversationMessage first = message("msg-1", "conv-1", candidate("c1", "a", null, false));
        ConversationMessage second = message("msg-2", "conv-1",
                candidate("c2", "b", null, false), candidate("c3", "c", null, false));
        when(messageRepository.findByUserIdAndCandidateIds(eq(USER), anyList())).thenReturn(List.of(first, second));

        importCoordinator.importNodes(USER, List.of("c1", "c2", "c3"), null);

        verify(messageRepository).markCurated("doc-msg-1", List.of("c1"));
        verify(messageRepository).markCurated("doc-msg-2", List.of("c2", "c3"));
    }

    @Test
    void importNodes_failsWhenNothingIsImportable() {
        when(messageRepository.findByUserIdAndCandidateIds(eq(USER), anyList())).thenReturn(List.of());

        assertThatThrownBy(() -> importCoordinator.importNodes(USER, List.of("ghost"), null))
                .isInstanceOf(GraphElementNotFoundException.class);
        verify(graphDocumentRepository, never()).save(any(GraphDocument.class));
        verifyNoInteractions(indexSynchronizer);
    }

    @Test
    void importNodes_rejectsEmptyIds() {
        assertThatThrownBy(() -> importCoordinator.importNodes(USER, List.of(), null))
                .isInstanceOf(InvalidGraphRequestException.class);
    }

    @Test
    void importNodes_embedsCommittedNodesEvenIfCuratedFlagIsNotSaved() {
        ConversationMessage message = message("msg-1", "conv-1", candidate("c1", "idea", null, false));
        when(messageRepository.findByUserIdAndCandidateIds(eq(USER), anyList())).thenReturn(List.of(message));
        when(messageRepository.markCurated(anyString(), anyCollection()))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        assertThatThrownBy(() -> importCoordinator.importNodes(USER, List.of("c1"), null))
                .isInstanceOf(GraphPersistenceException.class);

        assertThat(graph.getNodes()).hasSize(1);
        verify(indexSynchronizer).embedNodes(eq(USER), anyList(), isNull());
    }

    private static CandidateNode candidate(String id, String content, String label, boolean curated) {
        return CandidateNode.builder().id(id).content(content).label(label).curated(curated).build();
    }

    private static ConversationMessage message(String messageId, String conversationId, CandidateNode... nodes) {
        return ConversationMessage.builder()
                .id("doc-" + messageId)
                .messageId(messageId)
                .conversationId(conversationId)
                .userId(USER)
                .nodes(new ArrayList<>(List.of(nodes)))
                .build();
    }
}
