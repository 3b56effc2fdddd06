package com.querytuner.model.branch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querytuner.model.stats.StatValue;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores execution statistics as a JSON object in a CLOB column.
 */
@Slf4j
@Converter
public class ExecutionStatsConverter implements AttributeConverter<Map<String, StatValue>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, StatValue>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(Map<String, StatValue> stats) {
        try {
            return MAPPER.writeValueAsString(stats == null ? Map.of() : stats);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize execution stats", e);
        }
    }

    @Override
    public Map<String, StatValue> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(dbData, TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to read stored execution stats, treating as empty: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
