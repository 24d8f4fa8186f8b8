package com.ideation.memory.kgraph.repository;

import com.ideation.memory.kgraph.model.GraphDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GraphDocumentRepository extends MongoRepository<GraphDocument, String> {

    Optional<GraphDocument> findByUserId(String userId);

    long deleteByUserId(String userId);
}
