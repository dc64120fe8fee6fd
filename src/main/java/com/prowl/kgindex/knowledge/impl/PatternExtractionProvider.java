package com.prowl.kgindex.knowledge.impl;

import com.google.common.base.Preconditions;
import com.prowl.kgindex.core.EntityType;
import com.prowl.kgindex.core.ExtractedEntity;
import com.prowl.kgindex.core.ExtractedRelation;
import com.prowl.kgindex.core.ExtractionResult;
import com.prowl.kgindex.knowledge.ExtractionProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline entity extraction from surface patterns.
 *
 * <ul>
 *   <li>TECHNOLOGY - curated keywords plus tokens ending in {@code SQL}, {@code DB} or {@code .js}</li>
 *   <li>CONCEPT - curated phrases plus long lower-case words ending in {@code -ology} or {@code -ism}</li>
 *   <li>ORGANIZATION - capitalized multi-word sequences ending in an organization suffix</li>
 *   <li>PERSON - other capitalized sequences of two or three words</li>
 * </ul>
 *
 * Candidates are accepted in that priority (organizations, keywords, persons) and never overlap.
 * Every ordered pair of entities in the text gets a low-confidence {@code RELATED_TO} relation.
 *
 * @since 1.0.0
 */
@Slf4j
public class PatternExtractionProvider implements ExtractionProvider {

    public static final double CO_OCCURRENCE_CONFIDENCE = 0.3;
    public static final String SOURCE = "pattern";

    private static final String WORD_START = "(?<![\\p{L}\\p{N}])";
    private static final String WORD_END = "(?![\\p{L}\\p{N}])";

    private static final List<String> TECHNOLOGY_TERMS = List.of(
            "python", "java", "javascript", "typescript", "kotlin", "scala", "c++", "c#",
            "docker", "kubernetes", "terraform", "linux", "postgresql", "mysql", "sqlite", "redis",
            "kafka", "rabbitmq", "elasticsearch", "tensorflow", "pytorch", "keras", "scikit-learn",
            "pandas", "numpy", "spring boot", "fastapi", "django", "graphql", "openai", "langchain",
            "llamaindex", "sqlalchemy", "hadoop", "aws", "azure", "google cloud", "github", "git");

    // Ambiguous as common nouns or verbs, only matched with their proper capitalization
    private static final List<String> TECHNOLOGY_PROPER_NOUNS = List.of(
            "React", "Angular", "Flask", "Spark", "Rust", "Swift", "Go", "Node.js", "Vue.js");

    private static final List<String> CONCEPT_TERMS = List.of(
            "machine learning", "deep learning", "reinforcement learning", "supervised learning",
            "unsupervised learning", "neural network", "artificial intelligence",
            "natural language processing", "computer vision", "knowledge graph", "large language model",
            "retrieval augmented generation", "semantic search", "information retrieval", "data science",
            "big data", "cloud computing", "distributed system", "quantum computing", "microservice",
            "transformer", "embedding", "algorithm", "blockchain", "cryptography");

    private static final Set<String> ORGANIZATION_SUFFIXES = Set.of(
            "inc", "corp", "corporation", "company", "co", "ltd", "llc", "gmbh", "group", "university",
            "institute", "foundation", "labs", "laboratory", "laboratories", "association", "agency",
            "bank", "college", "school", "society", "council", "ministry", "department", "research");

    private static final Set<String> LEADING_STOPWORDS = Set.of(
            "the", "a", "an", "in", "on", "at", "this", "that", "these", "those", "when", "while",
            "after", "before", "our", "we", "it", "he", "she", "they", "and", "but", "or", "if",
            "for", "with", "by", "from", "to", "as", "dr", "mr", "mrs", "ms", "prof");

    private static final Set<String> SUFFIX_RULE_EXCLUSIONS = Set.of(
            "technology", "methodology", "mechanism", "organism", "terminology");

    // Sentence punctuation ends a sequence
    private static final Pattern CAPITALIZED_SEQUENCE = Pattern.compile(
            "(?<![\\p{L}\\p{N}])\\p{Lu}[\\p{L}\\p{N}&'-]*(?:[ \\t]+(?:of[ \\t]+|&[ \\t]+)?\\p{Lu}[\\p{L}\\p{N}&'-]*)+");

    private static final Pattern TECHNOLOGY_SUFFIX = Pattern.compile(
            WORD_START + "(?:[\\p{L}\\p{N}]+(?:SQL|DB)|[\\p{L}\\p{N}]+\\.js)" + WORD_END);

    private static final int MIN_SUFFIX_WORD_LENGTH = 7;

    private static final Pattern CONCEPT_SUFFIX = Pattern.compile(
            WORD_START + "\\p{Ll}{3,}(?:ology|ism)" + WORD_END);

    private static final List<KeywordPattern> KEYWORDS = buildKeywords();

    private final int maxEntities;

    public PatternExtractionProvider(int maxEntities) {
        Preconditions.checkArgument(maxEntities > 0, "maxEntities must be positive: %s", maxEntities);
        this.maxEntities = maxEntities;
    }

    @Override
    public ExtractionResult extract(String text) {
        if (text == null || text.isBlank()) {
            return ExtractionResult.empty();
        }

        List<Candidate> accepted = new ArrayList<>();
        List<Candidate> sequences = capitalizedSequences(text);

        sequences.stream().filter(c -> c.type == EntityType.ORGANIZATION).forEach(c -> accept(accepted, c));
        keywordCandidates(text).forEach(c -> accept(accepted, c));
        sequences.stream().filter(c -> c.type == EntityType.PERSON).forEach(c -> accept(accepted, c));

        accepted.sort(Comparator.comparingInt(c -> c.start));

        Map<String, ExtractedEntity> entities = new LinkedHashMap<>();
        for (Candidate candidate : accepted) {
            if (entities.size() >= maxEntities) {
                break;
            }
            String display = ExtractedEntity.normalize(candidate.text);
            if (display.isEmpty() || display.length() > ExtractedEntity.MAX_TEXT_LENGTH) {
                continue;
            }
            ExtractedEntity entity = ExtractedEntity.builder()
                    .text(display)
                    .type(candidate.type)
                    .metadata(new LinkedHashMap<>(Map.of("source", SOURCE)))
                    .build();
            entities.putIfAbsent(entity.getKey(), entity);
        }

        List<ExtractedEntity> entityList = new ArrayList<>(entities.values());
        List<ExtractedRelation> relations = new ArrayList<>();
        for (int i = 0; i < entityList.size(); i++) {
            for (int j = i + 1; j < entityList.size(); j++) {
                relations.add(new ExtractedRelation(
                        entityList.get(i).getKey(),
                        entityList.get(j).getKey(),
                        ExtractedRelation.RELATED_TO,
                        CO_OCCURRENCE_CONFIDENCE));
            }
        }

        log.debug("Pattern extraction: {} entities, {} relations from {} chars",
                entityList.size(), relations.size(), text.length());
        return new ExtractionResult(List.copyOf(entityList), List.copyOf(relations), false);
    }

    @Override
    public String getName() {
        return SOURCE;
    }

    private static void accept(List<Candidate> accepted, Candidate candidate) {
        for (Candidate existing : accepted) {
            if (candidate.start < existing.end && existing.start < candidate.end) {
                return;
            }
        }
        accepted.add(candidate);
    }

    private static List<Candidate> keywordCandidates(String text) {
        List<Candidate> candidates = new ArrayList<>();
        for (KeywordPattern keyword : KEYWORDS) {
            Matcher matcher = keyword.pattern.matcher(text);
            while (matcher.find()) {
                candidates.add(new Candidate(matcher.start(), matcher.end(), matcher.group(), keyword.type));
            }
        }

        Matcher technology = TECHNOLOGY_SUFFIX.matcher(text);
        while (technology.find()) {
            candidates.add(new Candidate(technology.start(), technology.end(), technology.group(), EntityType.TECHNOLOGY));
        }

        Matcher concept = CONCEPT_SUFFIX.matcher(text);
        while (concept.find()) {
            String word = concept.group();
            if (word.length() >= MIN_SUFFIX_WORD_LENGTH && !SUFFIX_RULE_EXCLUSIONS.contains(word)) {
                candidates.add(new Candidate(concept.start(), concept.end(), concept.group(), EntityType.CONCEPT));
            }
        }

        // Longest match wins among overlapping keywords
        candidates.sort(Comparator.comparingInt((Candidate c) -> c.start)
                .thenComparing(Comparator.comparingInt((Candidate c) -> c.end - c.start).reversed()));
        return candidates;
    }

    private static List<Candidate> capitalizedSequences(String text) {
        List<Candidate> candidates = new ArrayList<>();
        Matcher matcher = CAPITALIZED_SEQUENCE.matcher(text);
        while (matcher.find()) {
            String[] words = matcher.group().split("[ \\t]+");
            int first = 0;
            int offset = matcher.start();
            while (first < words.length && LEADING_STOPWORDS.contains(stripPunctuation(words[first]).toLowerCase(Locale.ROOT))) {
                offset += words[first].length();
                first++;
                while (offset < text.length() && (text.charAt(offset) == ' ' || text.charAt(offset) == '\t')) {
                    offset++;
                }
            }
            int remaining = words.length - first;
            if (remaining < 2) {
                continue;
            }

            String phrase = stripPunctuation(text.substring(offset, matcher.end()));
            String lastWord = stripPunctuation(words[words.length - 1]).toLowerCase(Locale.ROOT);
            boolean organization = ORGANIZATION_SUFFIXES.contains(lastWord)
                    || phrase.startsWith("University of");

            if (organization) {
                candidates.add(new Candidate(offset, offset + phrase.length(), phrase, EntityType.ORGANIZATION));
            } else if (remaining <= 3 && !phrase.contains(" of ") && !phrase.contains("&")) {
                candidates.add(new Candidate(offset, offset + phrase.length(), phrase, EntityType.PERSON));
            }
        }
        return candidates;
    }

    private static String stripPunctuation(String word) {
        return word.replaceAll("['&-]+$", "");
    }

    private static List<KeywordPattern> buildKeywords() {
        List<KeywordPattern> keywords = new ArrayList<>();
        for (String term : TECHNOLOGY_TERMS) {
            keywords.add(new KeywordPattern(
                    Pattern.compile(WORD_START + Pattern.quote(term) + WORD_END,
                            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                    EntityType.TECHNOLOGY));
        }
        for (String term : TECHNOLOGY_PROPER_NOUNS) {
            keywords.add(new KeywordPattern(
                    Pattern.compile(WORD_START + Pattern.quote(term) + WORD_END),
                    EntityType.TECHNOLOGY));
        }
        for (String term : CONCEPT_TERMS) {
            keywords.add(new KeywordPattern(
                    Pattern.compile(WORD_START + Pattern.quote(term) + "(?:s|es)?" + WORD_END,
                            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                    EntityType.CONCEPT));
        }
        return List.copyOf(keywords);
    }

    private static final class KeywordPattern {
        private final Pattern pattern;
        private final EntityType type;

        private KeywordPattern(Pattern pattern, EntityType type) {
            this.pattern = pattern;
            this.type = type;
        }
    }

    private static final class Candidate {
        private final int start;
        private final int end;
        private final String text;
        private final EntityType type;

        private Candidate(int start, int end, String text, EntityType type) {
            this.start = start;
            this.end = end;
            this.text = text;
            this.type = type;
        }
    }
}
