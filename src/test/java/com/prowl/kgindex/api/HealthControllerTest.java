package com.prowl.kgindex.api;

import com.prowl.kgindex.core.EmbeddedChunk;
import com.prowl.kgindex.core.ExtractedEntity;
import com.prowl.kgindex.core.ExtractedRelation;
import com.prowl.kgindex.core.ScoredChunk;
import com.prowl.kgindex.exception.StorageException;
import com.prowl.kgindex.knowledge.DocumentGraph;
import com.prowl.kgindex.knowledge.GraphStore;
import com.prowl.kgindex.knowledge.GraphWriteResult;
import com.prowl.kgindex.model.graph.KgDocument;
import com.prowl.kgindex.model.graph.KgEntity;
import com.prowl.kgindex.model.graph.KgRelation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Health endpoint against a store whose ping is scripted.
 */
@DisplayName("Health Controller Tests")
class HealthControllerTest {

    private static MockMvc mockMvc(Runnable ping) {
        return MockMvcBuilders.standaloneSetup(new HealthController(new PingOnlyStore(ping))).build();
    }

    @Test
    @DisplayName("GET /health returns 503 DOWN with the storage error when the database is unreachable")
    void health_storageDown_shouldReturnServiceUnavailable() throws Exception {
        // Given
        MockMvc mockMvc = mockMvc(() -> {
            throw new StorageException("Storage failure during ping",
                    new DataAccessResourceFailureException("Connection refused"));
        });

        // When / Then
        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("DOWN"))
            .andExpect(jsonPath("$.storage").value("Connection refused"))
            .andExpect(jsonPath("$.service").value(HealthResponse.SERVICE_NAME));
    }

    @Test
    @DisplayName("GET /health returns 200 UP when the ping succeeds")
    void health_storageUp_shouldReturnOk() throws Exception {
        mockMvc(() -> { }).perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.storage").value("connected"));
    }

    /**
     * Store that only answers ping; every other call is a test error.
     */
    private static final class PingOnlyStore implements GraphStore {
        private final Runnable ping;

        private PingOnlyStore(Runnable ping) {
            this.ping = ping;
        }

        @Override
        public void ping() {
            ping.run();
        }

        @Override
        public KgDocument upsertDocument(String documentId, String title, String content, Map<String, Object> metadata) {
            throw new UnsupportedOperationException();
        }

        @Override
        public int insertChunks(String documentId, List<EmbeddedChunk> chunks) {
            throw new UnsupportedOperationException();
        }

        @Override
        public GraphWriteResult insertEntitiesAndRelations(String documentId,
                                                           List<ExtractedEntity> entities,
                                                           List<ExtractedRelation> relations) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<ScoredChunk> similaritySearch(List<Double> queryVector, int topK) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<KgEntity> matchEntities(String text, int topK) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<KgEntity> findEntitiesMentionedIn(String text, int topK) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<KgRelation> findRelationsTouching(Collection<String> entityIds, Collection<String> documentIds) {
            throw new UnsupportedOperationException();
        }

        @Override
        public DocumentGraph getDocumentGraph(String documentId) {
            throw new UnsupportedOperationException();
        }
    }
}
