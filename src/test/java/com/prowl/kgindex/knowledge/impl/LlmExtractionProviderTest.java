package com.prowl.kgindex.knowledge.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prowl.kgindex.client.LLMProvider;
import com.prowl.kgindex.core.EntityType;
import com.prowl.kgindex.core.ExtractedEntity;
import com.prowl.kgindex.core.ExtractedRelation;
import com.prowl.kgindex.core.ExtractionResult;
import com.prowl.kgindex.exception.ExtractionException;
import com.prowl.kgindex.service.PromptLibraryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Reply parsing of the LLM extraction strategy and the degrading extraction wrapper.
 */
@DisplayName("LLM Extraction Provider Tests")
class LlmExtractionProviderTest {

    private static final String REPLY = """
            ```json
            {
              "entities": [
                {"text": "Alice  Johnson", "type": "PERSON"},
                {"text": "Acme Corp", "type": "organization"},
                {"text": "Rex", "type": "Animal"},
                {"text": "   ", "type": "PERSON"}
              ],
              "relations": [
                {"source": "Alice Johnson", "target": "Acme Corp", "type": "works at", "confidence": 0.95},
                {"source": "Alice Johnson", "target": "Rex", "type": "OWNS"},
                {"source": "Acme Corp", "target": "Rex", "type": "SPONSORS", "confidence": 1.7},
                {"source": "Alice Johnson", "target": "Bob", "type": "KNOWS", "confidence": 0.5}
              ]
            }
            ```
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PromptLibraryService promptLibrary;

    @BeforeEach
    void setUp() {
        promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
    }

    @Test
    @DisplayName("Parses a fenced JSON reply into entities and relations")
    void extract_fencedReply_shouldParse() {
        // Given
        RecordingProvider llm = new RecordingProvider(REPLY);
        LlmExtractionProvider provider = new LlmExtractionProvider(llm, promptLibrary, objectMapper, 10);

        // When
        ExtractionResult result = provider.extract("Alice Johnson works at Acme Corp and owns a dog named Rex.");

        // Then
        assertThat(result.getEntities())
                .extracting(ExtractedEntity::getText, ExtractedEntity::getType)
                .containsExactly(
                        tuple("Alice Johnson", EntityType.PERSON),
                        tuple("Acme Corp", EntityType.ORGANIZATION),
                        tuple("Rex", EntityType.OTHER));
        assertThat(result.getEntities()).allSatisfy(e -> assertEquals("llm", e.getMetadata().get("source")));

        assertThat(result.getRelations())
                .extracting(ExtractedRelation::getType, ExtractedRelation::getConfidence)
                .containsExactly(
                        tuple("WORKS_AT", 0.95),
                        tuple("OWNS", LlmExtractionProvider.DEFAULT_CONFIDENCE),
                        tuple("SPONSORS", 1.0));
        assertFalse(result.isDegraded());
    }

    @Test
    @DisplayName("Prompt carries the chunk text and the entity limit")
    void extract_shouldRenderPrompt() {
        RecordingProvider llm = new RecordingProvider("{\"entities\": []}");
        LlmExtractionProvider provider = new LlmExtractionProvider(llm, promptLibrary, objectMapper, 7);

        ExtractionResult result = provider.extract("Kubernetes schedules containers.");

        assertThat(result.getEntities()).isEmpty();
        assertThat(result.getRelations()).isEmpty();
        assertEquals(1, llm.userPrompts.size());
        assertThat(llm.userPrompts.get(0))
                .contains("Kubernetes schedules containers.")
                .contains("at most 7");
        assertEquals(0.1, llm.temperatures.get(0), 1e-9);
    }

    @Test
    @DisplayName("Entity limit also drops relations to entities past the limit")
    void extract_shouldCapEntities() {
        LlmExtractionProvider provider = new LlmExtractionProvider(
                new RecordingProvider(REPLY), promptLibrary, objectMapper, 2);

        ExtractionResult result = provider.extract("text");

        assertThat(result.getEntities()).extracting(ExtractedEntity::getText).containsExactly("Alice Johnson", "Acme Corp");
        assertThat(result.getRelations()).extracting(ExtractedRelation::getType).containsExactly("WORKS_AT");
    }

    @Test
    @DisplayName("Entities too long to store are skipped and relation types are capped")
    void extract_oversizedValues_shouldBeBounded() {
        // Given
        String longName = "Long ".repeat(130).trim();
        ObjectNode reply = objectMapper.createObjectNode();
        ArrayNode entities = reply.putArray("entities");
        entities.addObject().put("text", longName).put("type", "CONCEPT");
        entities.addObject().put("text", "Python").put("type", "TECHNOLOGY");
        entities.addObject().put("text", "Docker").put("type", "TECHNOLOGY");
        ArrayNode relations = reply.putArray("relations");
        relations.addObject().put("source", longName).put("target", "Python").put("type", "MENTIONS");
        relations.addObject().put("source", "Python").put("target", "Docker").put("type", "runs in " + "x".repeat(150));
        LlmExtractionProvider provider = new LlmExtractionProvider(
                new RecordingProvider(reply.toString()), promptLibrary, objectMapper, 10);

        // When
        ExtractionResult result = provider.extract("text");

        // Then
        assertThat(result.getEntities()).extracting(ExtractedEntity::getText).containsExactly("Python", "Docker");
        assertThat(result.getRelations()).hasSize(1);
        String type = result.getRelations().get(0).getType();
        assertEquals(ExtractedRelation.MAX_TYPE_LENGTH, type.length());
        assertTrue(type.startsWith("RUNS_IN_XXX"));
    }

    @Test
    @DisplayName("Non-conforming replies fail with ExtractionException")
    void extract_nonConformingReplies_shouldFail() {
        for (String reply : List.of(
                "Sure! Here are the entities: Alice, Acme.",
                "[{\"text\": \"Alice\"}]",
                "{\"relations\": []}",
                "{\"entities\": {\"text\": \"Alice\"}}",
                "{\"entities\": [], \"relations\": \"none\"}",
                "{\"error\": {\"message\": \"No endpoints found matching your data policy\"}}")) {
            LlmExtractionProvider provider = new LlmExtractionProvider(
                    new RecordingProvider(reply), promptLibrary, objectMapper, 10);

            assertThatThrownBy(() -> provider.extract("text"))
                    .as(reply)
                    .isInstanceOf(ExtractionException.class);
        }
    }

    @Test
    @DisplayName("Degrading wrapper runs the pattern strategy and flags the result")
    void degrading_remoteFailure_shouldFallBack() {
        LlmExtractionProvider remote = new LlmExtractionProvider(
                new RecordingProvider("not json at all"), promptLibrary, objectMapper, 10);
        DegradingExtractionProvider provider = new DegradingExtractionProvider(remote, new PatternExtractionProvider(10));

        ExtractionResult result = provider.extract("Alice Johnson uses Python.");

        assertTrue(result.isDegraded());
        assertThat(result.getEntities())
                .extracting(ExtractedEntity::getText)
                .containsExactly("Alice Johnson", "Python");
        assertThat(result.getEntities()).allSatisfy(e -> assertEquals("pattern", e.getMetadata().get("source")));
    }

    @Test
    @DisplayName("Degrading wrapper passes a good reply through unflagged")
    void degrading_remoteSuccess_shouldNotFlag() {
        LlmExtractionProvider remote = new LlmExtractionProvider(
                new RecordingProvider(REPLY), promptLibrary, objectMapper, 10);
        DegradingExtractionProvider provider = new DegradingExtractionProvider(remote, new PatternExtractionProvider(10));

        ExtractionResult result = provider.extract("anything");

        assertFalse(result.isDegraded());
        assertEquals(3, result.getEntities().size());
        assertTrue(provider.isRemoteConfigured());
    }

    @Test
    @DisplayName("Without a remote strategy the pattern result is not flagged")
    void degrading_noRemote_shouldNotFlag() {
        DegradingExtractionProvider provider = new DegradingExtractionProvider(null, new PatternExtractionProvider(10));

        ExtractionResult result = provider.extract("Alice Johnson uses Python.");

        assertFalse(result.isDegraded());
        assertEquals(2, result.getEntities().size());
    }

    private static final class RecordingProvider implements LLMProvider {
        private final String reply;
        private final List<String> userPrompts = new ArrayList<>();
        private final List<Double> temperatures = new ArrayList<>();

        private RecordingProvider(String reply) {
            this.reply = reply;
        }

        @Override
        public String chat(String systemPrompt, String userPrompt, Double temperature) {
            userPrompts.add(userPrompt);
            temperatures.add(temperature);
            return reply;
        }

        @Override
        public JsonNode embed(String text) {
            throw new UnsupportedOperationException();
        }

        @Override
        public String getProviderName() {
            return "recording";
        }
    }
}
