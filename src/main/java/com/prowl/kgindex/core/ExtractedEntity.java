package com.prowl.kgindex.core;

import lombok.Builder;
import lombok.Value;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Entity recognized in a piece of text, before it is persisted.
 *
 * <p>Two entities are the same when their {@link #getKey() key} matches: normalized,
 * case-insensitive text plus type.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class ExtractedEntity {

    /** Longest entity text the store accepts. */
    public static final int MAX_TEXT_LENGTH = 512;

    String text;
    EntityType type;

    @Builder.Default
    Map<String, Object> metadata = new HashMap<>();

    public String getKey() {
        return keyOf(text, type);
    }

    /**
     * Trim and collapse internal whitespace.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ");
    }

    public static String keyOf(String text, EntityType type) {
        return normalize(text).toLowerCase(Locale.ROOT) + "|" + type.name();
    }
}
