package com.ideation.memory.kgraph.service.importer;

import com.ideation.memory.kgraph.dto.graph.NodeResponse;
import com.ideation.memory.kgraph.exception.GraphElementNotFoundException;
import com.ideation.memory.kgraph.exception.GraphPersistenceException;
import com.ideation.memory.kgraph.exception.InvalidGraphRequestException;
import com.ideation.memory.kgraph.model.CandidateNode;
import com.ideation.memory.kgraph.model.ConversationMessage;
import com.ideation.memory.kgraph.model.GraphNode;
import com.ideation.memory.kgraph.repository.ConversationMessageRepository;
import com.ideation.memory.kgraph.service.embedding.IndexSynchronizer;
import com.ideation.memory.kgraph.service.graph.GraphDocumentMutator;
import com.ideation.memory.kgraph.service.graph.GraphMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Promotes scratch nodes attached to chat messages into the user's knowledge graph.
 *
 * Flow:
 * 1. Find the user's messages carrying the requested candidates
 * 2. Build graph nodes from candidates not curated yet, keeping their provenance
 * 3. Append them to the graph in one write
 * 4. Set the curated flag of each promoted candidate on its message
 * 5. Embed the new nodes in one batch
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportCoordinator {

    static final String DEFAULT_CONTENT = "New node";

    private final ConversationMessageRepository messageRepository;
    private final GraphDocumentMutator mutator;
    private final IndexSynchronizer indexSynchronizer;

    public List<NodeResponse> importNodes(String userId, List<String> nodeIds, String authorization) {
        if (nodeIds == null || nodeIds.isEmpty()) {
            throw new InvalidGraphRequestException("nodeIds must not be empty");
        }
        Set<String> wanted = new HashSet<>(nodeIds);

        List<ConversationMessage> messages = findMessages(userId, nodeIds);
        List<ConversationMessage> touchedMessages = new ArrayList<>();
        List<PromotedCandidate> promoted = new ArrayList<>();

        for (ConversationMessage message : messages) {
            boolean messageTouched = false;
            for (CandidateNode candidate : message.getNodes()) {
                if (!wanted.contains(candidate.getId())) {
                    continue;
                }
                if (candidate.isCurated()) {
                    log.info("[Import] Candidate {} already curated, skipping (userId: {})", candidate.getId(), userId);
                    continue;
                }
                promoted.add(new PromotedCandidate(candidate, message));
                messageTouched = true;
            }
            if (messageTouched) {
                touchedMessages.add(message);
            }
        }

        if (promoted.isEmpty()) {
            throw new GraphElementNotFoundException("No importable candidate nodes found for ids: " + nodeIds);
        }

        List<NodeResponse> created = mutator.mutate(userId, graph -> {
            LocalDateTime now = LocalDateTime.now();
            List<NodeResponse> added = new ArrayList<>();
            for (PromotedCandidate p : promoted) {
                GraphNode node = toGraphNode(p.candidate(), p.message(), now);
                graph.getNodes().add(node);
                added.add(GraphMapper.toResponse(node));
            }
            return added;
        });
        log.info("[Import] Added {} nodes from {} messages (userId: {})", created.size(), touchedMessages.size(), userId);

        try {
            markCurated(userId, promoted);
        } finally {
            // The nodes are committed either way
            indexSynchronizer.embedNodes(userId, created.stream().map(GraphMapper::toEmbedding).toList(), authorization);
        }
        return created;
    }

    private List<ConversationMessage> findMessages(String userId, List<String> nodeIds) {
        try {
            return messageRepository.findByUserIdAndCandidateIds(userId, nodeIds);
        } catch (DataAccessException e) {
            throw new GraphPersistenceException("Failed to load messages for import", e);
        }
    }

    private void markCurated(String userId, List<PromotedCandidate> promoted) {
        Map<String, List<String>> candidatesByMessage = new LinkedHashMap<>();
        for (PromotedCandidate p : promoted) {
            candidatesByMessage.computeIfAbsent(p.message().getId(), id -> new ArrayList<>())
                    .add(p.candidate().getId());
        }

        try {
            candidatesByMessage.forEach(messageRepository::markCurated);
        } catch (DataAccessException e) {
            // The graph already holds the nodes; an unflagged candidate can be imported twice
            throw new GraphPersistenceException(
                    "Imported nodes for user " + userId + " but failed to mark candidates curated", e);
        }
    }

    private static GraphNode toGraphNode(CandidateNode candidate, ConversationMessage message, LocalDateTime now) {
        String content = firstNonBlank(candidate.getContent(), candidate.getLabel(), DEFAULT_CONTENT);
        List<String> labels = new ArrayList<>();
        if (candidate.getLabel() != null && !candidate.getLabel().isBlank()) {
            labels.add(candidate.getLabel());
        }

        return GraphNode.builder()
                .id(GraphNode.newId())
                .content(content)
                .label(labels)
                .x(candidate.getX() != null ? candidate.getX() : 0)
                .y(candidate.getY() != null ? candidate.getY() : 0)
                .sourceMessageId(message.getMessageId())
                .sourceConversationId(message.getConversationId())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }

    private record PromotedCandidate(CandidateNode candidate, ConversationMessage message) {}
}
