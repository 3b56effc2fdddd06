package com.querytuner.model.branch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querytuner.model.explain.ExplainResult;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores a version's EXPLAIN results as a JSON array in a CLOB column.
 *
 * <p>Unreadable JSON loads as an empty list (logged) so one corrupt row does not break a
 * whole history listing.
 */
@Slf4j
@Converter
public class ExplainResultsConverter implements AttributeConverter<List<ExplainResult>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<ExplainResult>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<ExplainResult> results) {
        try {
            return MAPPER.writeValueAsString(results == null ? List.of() : results);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize explain results", e);
        }
    }

    @Override
    public List<ExplainResult> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return MAPPER.readValue(dbData, TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to read stored explain results, treating as empty: {}", e.getMessage());
            return new ArrayList<>();
        }
    }
}
