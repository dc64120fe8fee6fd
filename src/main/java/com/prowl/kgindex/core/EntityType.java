package com.prowl.kgindex.core;

import java.util.Locale;

/**
 * Entity types in the knowledge graph.
 *
 * @since 1.0.0
 */
public enum EntityType {
    PERSON,
    ORGANIZATION,
    CONCEPT,
    TECHNOLOGY,
    OTHER;

    /**
     * Resolve a free-form label (as returned by a model) to a type. Unknown labels map to {@link #OTHER}.
     */
    public static EntityType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "PERSON", "PEOPLE" -> PERSON;
            case "ORGANIZATION", "ORGANISATION", "ORG", "COMPANY" -> ORGANIZATION;
            case "CONCEPT", "TOPIC" -> CONCEPT;
            case "TECHNOLOGY", "TECH", "TOOL", "FRAMEWORK", "LANGUAGE" -> TECHNOLOGY;
            default -> OTHER;
        };
    }
}
