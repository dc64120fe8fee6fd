package com.prowl.kgindex.knowledge.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.prowl.kgindex.client.LLMProvider;
import com.prowl.kgindex.core.EntityType;
import com.prowl.kgindex.core.ExtractedEntity;
import com.prowl.kgindex.core.ExtractedRelation;
import com.prowl.kgindex.core.ExtractionResult;
import com.prowl.kgindex.exception.ExtractionException;
import com.prowl.kgindex.knowledge.ExtractionProvider;
import com.prowl.kgindex.model.prompt.RenderedPrompt;
import com.prowl.kgindex.service.PromptLibraryService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entity and relation extraction through a chat-completion model.
 *
 * Renders the {@code entity-extraction} prompt, sends it through {@link LLMProvider#chat} and
 * parses the JSON reply. Anything that is not the expected JSON object fails the call with
 * {@link ExtractionException}.
 *
 * @since 1.0.0
 */
@Slf4j
public class LlmExtractionProvider implements ExtractionProvider {

    public static final String PROMPT_TEMPLATE = "entity-extraction";
    public static final String SOURCE = "llm";
    public static final double DEFAULT_CONFIDENCE = 0.9;

    private final LLMProvider llmProvider;
    private final PromptLibraryService promptLibrary;
    private final ObjectMapper objectMapper;
    private final int maxEntities;

    public LlmExtractionProvider(LLMProvider llmProvider,
                                 PromptLibraryService promptLibrary,
                                 ObjectMapper objectMapper,
                                 int maxEntities) {
        Preconditions.checkArgument(maxEntities > 0, "maxEntities must be positive: %s", maxEntities);
        this.llmProvider = Preconditions.checkNotNull(llmProvider, "llmProvider");
        this.promptLibrary = Preconditions.checkNotNull(promptLibrary, "promptLibrary");
        this.objectMapper = Preconditions.checkNotNull(objectMapper, "objectMapper");
        this.maxEntities = maxEntities;
    }

    @Override
    public ExtractionResult extract(String text) {
        RenderedPrompt prompt = promptLibrary.render(PROMPT_TEMPLATE, Map.of(
                "text", text,
                "maxEntities", maxEntities
        ));

        String reply = llmProvider.chat(prompt.getSystemPrompt(), prompt.getUserPrompt(), prompt.getTemperature());
        log.debug("Extraction reply ({} chars): {}", reply.length(), truncate(reply));

        return parse(reply);
    }

    @Override
    public String getName() {
        return SOURCE + ":" + llmProvider.getProviderName();
    }

    ExtractionResult parse(String reply) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFences(reply));
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Extraction reply is not JSON: " + truncate(reply), e);
        }

        if (root == null || !root.isObject()) {
            throw new ExtractionException("Extraction reply is not a JSON object");
        }
        if (root.hasNonNull("error")) {
            throw new ExtractionException("Extraction rejected: " + root.path("error").path("message").asText(root.path("error").toString()));
        }

        JsonNode entitiesNode = root.get("entities");
        if (entitiesNode == null || !entitiesNode.isArray()) {
            throw new ExtractionException("Extraction reply has no 'entities' array");
        }
        JsonNode relationsNode = root.get("relations");
        if (relationsNode != null && !relationsNode.isNull() && !relationsNode.isArray()) {
            throw new ExtractionException("Extraction reply has a non-array 'relations' field");
        }

        Map<String, ExtractedEntity> entities = new LinkedHashMap<>();
        // Relations name entities by text only
        Map<String, String> keysByText = new HashMap<>();
        int oversized = 0;

        for (JsonNode node : entitiesNode) {
            if (entities.size() >= maxEntities) {
                break;
            }
            String display = ExtractedEntity.normalize(node.path("text").asText(""));
            if (display.isEmpty()) {
                continue;
            }
            if (display.length() > ExtractedEntity.MAX_TEXT_LENGTH) {
                oversized++;
                continue;
            }
            ExtractedEntity entity = ExtractedEntity.builder()
                    .text(display)
                    .type(EntityType.fromLabel(node.path("type").asText(null)))
                    .metadata(new LinkedHashMap<>(Map.of("source", SOURCE)))
                    .build();
            entities.putIfAbsent(entity.getKey(), entity);
            keysByText.putIfAbsent(display.toLowerCase(Locale.ROOT), entity.getKey());
        }

        List<ExtractedRelation> relations = new ArrayList<>();
        int discarded = 0;
        if (relationsNode != null && relationsNode.isArray()) {
            for (JsonNode node : relationsNode) {
                String sourceKey = keysByText.get(ExtractedEntity.normalize(node.path("source").asText("")).toLowerCase(Locale.ROOT));
                String targetKey = keysByText.get(ExtractedEntity.normalize(node.path("target").asText("")).toLowerCase(Locale.ROOT));
                if (sourceKey == null || targetKey == null) {
                    discarded++;
                    continue;
                }
                JsonNode confidence = node.get("confidence");
                relations.add(new ExtractedRelation(
                        sourceKey,
                        targetKey,
                        relationType(node.path("type").asText("")),
                        confidence != null && confidence.isNumber() ? confidence.asDouble() : DEFAULT_CONFIDENCE));
            }
        }

        if (oversized > 0) {
            log.debug("Skipped {} entities longer than {} chars", oversized, ExtractedEntity.MAX_TEXT_LENGTH);
        }
        if (discarded > 0) {
            log.debug("Discarded {} relations naming unknown entities", discarded);
        }
        return new ExtractionResult(List.copyOf(entities.values()), List.copyOf(relations), false);
    }

    static String relationType(String label) {
        String normalized = label.trim()
                .replaceAll("[\\s-]+", "_")
                .toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return ExtractedRelation.RELATED_TO;
        }
        return normalized.length() > ExtractedRelation.MAX_TYPE_LENGTH
                ? normalized.substring(0, ExtractedRelation.MAX_TYPE_LENGTH)
                : normalized;
    }

    static String stripCodeFences(String reply) {
        if (reply == null) {
            return "";
        }
        String trimmed = reply.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            trimmed = firstNewline < 0 ? "" : trimmed.substring(firstNewline + 1);
            int closing = trimmed.lastIndexOf("```");
            if (closing >= 0) {
                trimmed = trimmed.substring(0, closing);
            }
        }
        return trimmed.trim();
    }

    private static String truncate(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
