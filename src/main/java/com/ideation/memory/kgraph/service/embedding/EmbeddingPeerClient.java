package com.ideation.memory.kgraph.service.embedding;

import com.ideation.memory.kgraph.dto.embedding.ClusterPoint;
import com.ideation.memory.kgraph.dto.embedding.EdgeEmbedding;
import com.ideation.memory.kgraph.dto.embedding.NodeEmbedding;
import com.ideation.memory.kgraph.dto.embedding.ScoredCandidate;
import com.ideation.memory.kgraph.exception.EmbeddingPeerException;
import com.ideation.memory.kgraph.model.IndexCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST client for the embedding/clustering peer.
 * Every failure (error status, timeout, unreachable host) is raised as {@link EmbeddingPeerException};
 * deciding whether that failure matters is up to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingPeerClient {

    static final String EMBED_NODE_PATH = "/embed/node";
    static final String EMBED_EDGE_PATH = "/embed/edge";
    static final String DELETE_PATH = "/embed/delete";
    static final String RESET_PATH = "/embed/reset";
    static final String UMAP_PATH = "/calculate-umap";
    static final String RECOMMEND_PATH = "/recommend/{method}";

    private static final ParameterizedTypeReference<List<ClusterPoint>> CLUSTER_POINTS =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<ScoredCandidate>> SCORED_CANDIDATES =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate embeddingRestTemplate;

    @Value("${kgraph.embedding.service-token:}")
    private String serviceToken;

    /**
     * Send one propagation command to the peer.
     *
     * @param authorization caller credential to forward; the service token is used when absent
     */
    public void execute(IndexCommand command, String authorization) {
        switch (command.getOperation()) {
            case EMBED_NODES -> embedNodes(command.getUserId(), command.getNodes(), authorization);
            case EMBED_EDGES -> embedEdges(command.getUserId(), command.getEdges(), authorization);
            case DELETE -> delete(command.getUserId(), command.getIds(), authorization);
            case RESET -> reset(command.getUserId(), authorization);
        }
    }

    public void embedNodes(String userId, List<NodeEmbedding> nodes, String authorization) {
        post("embed_node", EMBED_NODE_PATH, Map.of("user_id", userId, "nodes", nodes), authorization);
        log.debug("[Embedding Peer] Embedded {} nodes for user {}", nodes.size(), userId);
    }

    public void embedEdges(String userId, List<EdgeEmbedding> edges, String authorization) {
        post("embed_edge", EMBED_EDGE_PATH, Map.of("user_id", userId, "edges", edges), authorization);
        log.debug("[Embedding Peer] Embedded {} edges for user {}", edges.size(), userId);
    }

    public void delete(String userId, List<String> ids, String authorization) {
        post("delete", DELETE_PATH, Map.of("user_id", userId, "ids", ids), authorization);
        log.debug("[Embedding Peer] Deleted {} vectors for user {}", ids.size(), userId);
    }

    public void reset(String userId, String authorization) {
        post("reset", RESET_PATH, Map.of("user_id", userId), authorization);
        log.debug("[Embedding Peer] Reset vectors for user {}", userId);
    }

    /**
     * Ask the peer for 2-D layout coordinates of all the user's nodes.
     *
     * @return points in the peer's normalized coordinate space
     */
    public List<ClusterPoint> calculateLayout(String userId, String authorization) {
        try {
            ResponseEntity<List<ClusterPoint>> response = embeddingRestTemplate.exchange(
                    UMAP_PATH,
                    HttpMethod.POST,
                    entity(Map.of("user_id", userId), authorization),
                    CLUSTER_POINTS);

            List<ClusterPoint> points = response.getBody();
            return points != null ? points : Collections.emptyList();
        } catch (RestClientException e) {
            throw translate("compute_layout", e);
        }
    }

    /**
     * Run a peer-side recommendation method.
     */
    public List<ScoredCandidate> recommend(String userId, String method, Map<String, Object> params) {
        Map<String, Object> body = new HashMap<>(params);
        body.put("user_id", userId);

        try {
            ResponseEntity<List<ScoredCandidate>> response = embeddingRestTemplate.exchange(
                    RECOMMEND_PATH,
                    HttpMethod.POST,
                    entity(body, null),
                    SCORED_CANDIDATES,
                    method);

            List<ScoredCandidate> candidates = response.getBody();
            return candidates != null ? candidates : Collections.emptyList();
        } catch (RestClientException e) {
            throw translate("recommend/" + method, e);
        }
    }

    private void post(String operation, String path, Map<String, Object> body, String authorization) {
        try {
            ResponseEntity<String> response = embeddingRestTemplate.exchange(
                    path, HttpMethod.POST, entity(body, authorization), String.class);

            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new EmbeddingPeerException(operation, response.getStatusCode().value(), response.getBody(),
                        "Unexpected response status " + response.getStatusCode().value(), null);
            }
        } catch (RestClientException e) {
            throw translate(operation, e);
        }
    }

    private HttpEntity<Map<String, Object>> entity(Map<String, Object> body, String authorization) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        String credential = authorization != null && !authorization.isBlank() ? authorization : serviceToken;
        if (credential != null && !credential.isBlank()) {
            headers.set(HttpHeaders.AUTHORIZATION, credential);
        }
        return new HttpEntity<>(body, headers);
    }

    private EmbeddingPeerException translate(String operation, RestClientException e) {
        if (e instanceof RestClientResponseException responseException) {
            return new EmbeddingPeerException(operation, responseException.getStatusCode().value(),
                    responseException.getResponseBodyAsString(), e.getMessage(), e);
        }
        return new EmbeddingPeerException(operation, null, null, e.getMessage(), e);
    }
}
