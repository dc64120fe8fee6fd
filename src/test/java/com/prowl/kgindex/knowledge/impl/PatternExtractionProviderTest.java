package com.prowl.kgindex.knowledge.impl;

import com.prowl.kgindex.core.EntityType;
import com.prowl.kgindex.core.ExtractedEntity;
import com.prowl.kgindex.core.ExtractedRelation;
import com.prowl.kgindex.core.ExtractionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pattern Extraction Provider Tests")
class PatternExtractionProviderTest {

    private final PatternExtractionProvider provider = new PatternExtractionProvider(10);

    @Test
    @DisplayName("Recognizes persons, organizations, technologies and concepts in text order")
    void extract_mixedText_shouldFindAllTypes() {
        // Given
        String text = "Alice Johnson works at Acme Corporation in Berlin. "
                + "She uses Python and Docker for machine learning research.";

        // When
        ExtractionResult result = provider.extract(text);

        // Then
        assertThat(result.getEntities())
                .extracting(ExtractedEntity::getText, ExtractedEntity::getType)
                .containsExactly(
                        tuple("Alice Johnson", EntityType.PERSON),
                        tuple("Acme Corporation", EntityType.ORGANIZATION),
                        tuple("Python", EntityType.TECHNOLOGY),
                        tuple("Docker", EntityType.TECHNOLOGY),
                        tuple("machine learning", EntityType.CONCEPT));
        assertFalse(result.isDegraded());
        assertThat(result.getEntities()).allSatisfy(e -> assertEquals("pattern", e.getMetadata().get("source")));
    }

    @Test
    @DisplayName("Every earlier entity is related to every later one with low confidence")
    void extract_shouldRelateCoOccurringEntities() {
        ExtractionResult result = provider.extract("Alice Johnson works at Acme Corporation and writes Python.");

        List<ExtractedEntity> entities = result.getEntities();
        assertEquals(3, entities.size());
        assertThat(result.getRelations())
                .extracting(ExtractedRelation::getSourceKey, ExtractedRelation::getTargetKey)
                .containsExactly(
                        tuple(entities.get(0).getKey(), entities.get(1).getKey()),
                        tuple(entities.get(0).getKey(), entities.get(2).getKey()),
                        tuple(entities.get(1).getKey(), entities.get(2).getKey()));
        assertThat(result.getRelations()).allSatisfy(r -> {
            assertEquals(ExtractedRelation.RELATED_TO, r.getType());
            assertEquals(0.3, r.getConfidence(), 1e-9);
        });
    }

    @Test
    @DisplayName("Organization rules: suffix words and 'University of'")
    void extract_organizations() {
        assertThat(provider.extract("She studied at the University of Cambridge.").getEntities())
                .extracting(ExtractedEntity::getText, ExtractedEntity::getType)
                .containsExactly(tuple("University of Cambridge", EntityType.ORGANIZATION));

        // Leading article is dropped and the organization wins over the keyword inside it
        assertThat(provider.extract("The Python Software Foundation maintains CPython.").getEntities())
                .extracting(ExtractedEntity::getText, ExtractedEntity::getType)
                .containsExactly(tuple("Python Software Foundation", EntityType.ORGANIZATION));
    }

    @Test
    @DisplayName("Suffix rules find technologies and -ology/-ism concepts")
    void extract_suffixRules() {
        ExtractionResult result = provider.extract(
                "We store vectors in PostgreSQL and MongoDB, render with Vue.js, and study epistemology and pragmatism.");

        assertThat(result.getEntities())
                .extracting(ExtractedEntity::getText, ExtractedEntity::getType)
                .containsExactly(
                        tuple("PostgreSQL", EntityType.TECHNOLOGY),
                        tuple("MongoDB", EntityType.TECHNOLOGY),
                        tuple("Vue.js", EntityType.TECHNOLOGY),
                        tuple("epistemology", EntityType.CONCEPT),
                        tuple("pragmatism", EntityType.CONCEPT));
    }

    @Test
    @DisplayName("Capitalized keyword phrases are not mistaken for persons")
    void extract_keywordPhrase_shouldNotBePerson() {
        assertThat(provider.extract("Machine Learning is popular.").getEntities())
                .extracting(ExtractedEntity::getText, ExtractedEntity::getType)
                .containsExactly(tuple("Machine Learning", EntityType.CONCEPT));
    }

    @Test
    @DisplayName("Entities are deduplicated case-insensitively, first spelling wins")
    void extract_duplicates_shouldCollapse() {
        ExtractionResult result = provider.extract("Python is great. I love python.");

        assertThat(result.getEntities()).extracting(ExtractedEntity::getText).containsExactly("Python");
        assertThat(result.getRelations()).isEmpty();
    }

    @Test
    @DisplayName("Entity count is capped")
    void extract_shouldCapEntities() {
        PatternExtractionProvider capped = new PatternExtractionProvider(2);

        ExtractionResult result = capped.extract("Python, Java, Docker and Kubernetes run the platform.");

        assertThat(result.getEntities()).extracting(ExtractedEntity::getText).containsExactly("Python", "Java");
        assertThat(result.getRelations()).hasSize(1);
    }

    @Test
    @DisplayName("Never throws and never returns a relation to an unknown entity")
    void extract_anyInput_shouldBeSafe() {
        List<String> inputs = Arrays.asList(
                null, "", "   ", "((((", "1234 5678", "lowercase words only here",
                "Ünïcödé Straße GmbH partners with Dr. Marie Curie Institute",
                "🚀 Rocket emoji 🚀 and C++ and C# and Node.js",
                "Modern technology and mechanism",
                "A".repeat(5000));

        for (String input : inputs) {
            ExtractionResult result = assertDoesNotThrow(() -> provider.extract(input));

            Set<String> keys = result.getEntities().stream().map(ExtractedEntity::getKey).collect(Collectors.toSet());
            assertEquals(result.getEntities().size(), keys.size(), "unique keys for " + input);
            for (ExtractedRelation relation : result.getRelations()) {
                assertTrue(keys.contains(relation.getSourceKey()), "dangling source for " + input);
                assertTrue(keys.contains(relation.getTargetKey()), "dangling target for " + input);
            }
            assertThat(result.getEntities()).allSatisfy(e -> assertFalse(e.getText().isBlank()));
        }
    }

    @Test
    @DisplayName("Entity-free text gives an empty result")
    void extract_entityFreeText_shouldBeEmpty() {
        ExtractionResult result = provider.extract("Modern technology and mechanism");

        assertThat(result.getEntities()).isEmpty();
        assertThat(result.getRelations()).isEmpty();
    }

    @Test
    @DisplayName("A name longer than the store accepts is skipped, the rest of the text still yields entities")
    void extract_oversizedName_shouldBeSkipped() {
        // Given
        String text = "Alpha ".repeat(110) + "Corporation uses Python.";

        // When
        ExtractionResult result = provider.extract(text);

        // Then
        assertThat(result.getEntities())
                .extracting(ExtractedEntity::getText)
                .containsExactly("Python");
        assertThat(result.getEntities())
                .allSatisfy(e -> assertThat(e.getText().length()).isLessThanOrEqualTo(ExtractedEntity.MAX_TEXT_LENGTH));
        assertThat(result.getRelations()).isEmpty();
    }
}
