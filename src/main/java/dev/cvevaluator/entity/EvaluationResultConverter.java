package dev.cvevaluator.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.cvevaluator.model.EvaluationResult;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores the evaluation result as a JSON document in a single text column.
 */
@Converter
public class EvaluationResultConverter implements AttributeConverter<EvaluationResult, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(EvaluationResult attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize evaluation result", e);
        }
    }

    @Override
    public EvaluationResult convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, EvaluationResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize evaluation result", e);
        }
    }
}
