package com.prowl.kgindex.model.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores an embedding as a JSON array in a text column, e.g. {@code [0.12,-0.4,...]}.
 */
@Converter
public class EmbeddingConverter implements AttributeConverter<List<Double>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Double>> VECTOR_TYPE = new TypeReference<>() { };

    @Override
    public String convertToDatabaseColumn(List<Double> attribute) {
        if (attribute == null) return null;

        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < attribute.size(); i++) {
            sb.append(attribute.get(i));
            if (i < attribute.size() - 1) sb.append(",");
        }
        sb.append("]");
        return sb.toString();
    }

    @Override
    public List<Double> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return null;

        try {
            return MAPPER.readValue(dbData, VECTOR_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored embedding is not a JSON array", e);
        }
    }
}
