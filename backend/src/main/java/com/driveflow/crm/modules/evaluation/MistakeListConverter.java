package com.driveflow.crm.modules.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stores the mistake list as a JSON array of {@code {"itemId":..,"count":..}}
 * objects. Both directions reject entries that break the list's shape: unknown
 * fields, non-positive ids or counts, repeated item ids.
 */
@Converter
public class MistakeListConverter implements AttributeConverter<List<MistakeEntry>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES);
    private static final TypeReference<List<MistakeEntry>> LIST_TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<MistakeEntry> mistakes) {
        List<MistakeEntry> value = mistakes != null ? mistakes : List.of();
        requireWellFormed(value);
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not encode mistake list", e);
        }
    }

    @Override
    public List<MistakeEntry> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        List<MistakeEntry> mistakes;
        try {
            mistakes = MAPPER.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored mistake list is not valid JSON", e);
        }
        requireWellFormed(mistakes);
        return List.copyOf(mistakes);
    }

    private static void requireWellFormed(List<MistakeEntry> mistakes) {
        Set<Long> seen = new HashSet<>();
        for (MistakeEntry entry : mistakes) {
            if (entry == null || entry.itemId() <= 0 || entry.count() <= 0) {
                throw new IllegalArgumentException("Malformed mistake entry: " + entry);
            }
            if (!seen.add(entry.itemId())) {
                throw new IllegalArgumentException("Repeated item in mistake list: " + entry.itemId());
            }
        }
    }
}
