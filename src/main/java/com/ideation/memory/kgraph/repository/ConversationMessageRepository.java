package com.ideation.memory.kgraph.repository;

import com.ideation.memory.kgraph.model.ConversationMessage;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ConversationMessageRepository extends MongoRepository<ConversationMessage, String>,
        CandidateCurationRepository {

    // Messages of the user carrying at least one of the given scratch nodes
    @Query("{ 'user': ?0, 'nodes._id': { $in: ?1 } }")
    List<ConversationMessage> findByUserIdAndCandidateIds(String userId, Collection<String> candidateIds);
}
