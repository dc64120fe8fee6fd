package com.prowl.kgindex.core;

import lombok.Value;

/**
 * Directed edge between two extracted entities, addressed by their keys.
 */
@Value
public class ExtractedRelation {

    public static final String RELATED_TO = "RELATED_TO";
    public static final int MAX_TYPE_LENGTH = 100;

    String sourceKey;
    String targetKey;
    String type;
    double confidence;

    public ExtractedRelation(String sourceKey, String targetKey, String type, double confidence) {
        this.sourceKey = sourceKey;
        this.targetKey = targetKey;
        this.type = type;
        this.confidence = clamp(confidence);
    }

    public String edgeKey() {
        return sourceKey + "->" + targetKey + ":" + type;
    }

    public static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
