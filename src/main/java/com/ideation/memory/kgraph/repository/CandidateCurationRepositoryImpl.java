package com.ideation.memory.kgraph.repository;

import com.ideation.memory.kgraph.model.ConversationMessage;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Collection;

@RequiredArgsConstructor
public class CandidateCurationRepositoryImpl implements CandidateCurationRepository {

    static final String CURATED_PATH = "nodes.$.isCurated";

    private final MongoTemplate mongoTemplate;

    @Override
    public long markCurated(String messageId, Collection<String> candidateIds) {
        long modified = 0;
        for (String candidateId : candidateIds) {
            Query query = new Query(Criteria.where("_id").is(messageId).and("nodes._id").is(candidateId));
            UpdateResult result = mongoTemplate.updateFirst(query, new Update().set(CURATED_PATH, true),
                    ConversationMessage.class);
            modified += result.getModifiedCount();
        }
        return modified;
    }
}
