package com.ideation.memory.kgraph.repository;

import com.ideation.memory.kgraph.model.ConversationMessage;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.UpdateDefinition;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CandidateCurationRepositoryImplTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @InjectMocks
    private CandidateCurationRepositoryImpl repository;

    @Test
    void markCurated_setsOnlyTheCuratedFlagOfEachCandidate() {
        when(mongoTemplate.updateFirst(any(Query.class), any(UpdateDefinition.class), eq(ConversationMessage.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        long modified = repository.markCurated("msg-doc-1", List.of("c1", "c2"));

        assertThat(modified).isEqualTo(2);
        ArgumentCaptor<Query> queries = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<UpdateDefinition> updates = ArgumentCaptor.forClass(UpdateDefinition.class);
        verify(mongoTemplate, times(2)).updateFirst(queries.capture(), updates.capture(), eq(ConversationMessage.class));
        verifyNoMoreInteractions(mongoTemplate);

        assertThat(queries.getAllValues()).extracting(Query::getQueryObject).containsExactly(
                new Document("_id", "msg-doc-1").append("nodes._id", "c1"),
                new Document("_id", "msg-doc-1").append("nodes._id", "c2"));
        assertThat(updates.getAllValues()).allSatisfy(update -> assertThat(update.getUpdateObject())
                .isEqualTo(new Document("$set", new Document("nodes.$.isCurated", true))));
    }

    @Test
    void markCurated_countsOnlyModifiedCandidates() {
        when(mongoTemplate.updateFirst(any(Query.class), any(UpdateDefinition.class), eq(ConversationMessage.class)))
                .thenReturn(UpdateResult.acknowledged(1, 0L, null));

        assertThat(repository.markCurated("msg-doc-1", List.of("already-curated"))).isZero();
    }
}
