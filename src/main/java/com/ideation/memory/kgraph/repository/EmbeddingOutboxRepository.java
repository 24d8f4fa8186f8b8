package com.ideation.memory.kgraph.repository;

import com.ideation.memory.kgraph.model.EmbeddingOutboxEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmbeddingOutboxRepository extends MongoRepository<EmbeddingOutboxEntry, String> {

    List<EmbeddingOutboxEntry> findByStatus(String status, Pageable pageable);

    boolean existsByUserIdAndStatus(String userId, String status);

    long deleteByUserIdAndStatus(String userId, String status);
}
