package dev.cvevaluator.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.cvevaluator.exception.SchemaValidationException;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Turns raw model text into a typed value. Tolerates markdown code fences, prose around the
 * JSON payload and trailing commas; anything else is a schema failure.
 */
@Component
public class ModelJsonParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");

    private final ObjectMapper objectMapper;

    public ModelJsonParser() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public <T> T parse(String text, Class<T> type) {
        if (text == null || text.isBlank()) {
            throw new SchemaValidationException("Model returned empty output");
        }

        String json = extractJson(text);
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new SchemaValidationException("Model returned a null JSON value");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("Model output is not valid JSON for "
                    + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    String extractJson(String text) {
        String cleaned = CODE_FENCE.matcher(text).replaceAll("").trim();

        int objectStart = cleaned.indexOf('{');
        int arrayStart = cleaned.indexOf('[');
        int start;
        char close;
        if (objectStart >= 0 && (arrayStart < 0 || objectStart < arrayStart)) {
            start = objectStart;
            close = '}';
        } else if (arrayStart >= 0) {
            start = arrayStart;
            close = ']';
        } else {
            throw new SchemaValidationException("No JSON payload found in model output");
        }

        int end = cleaned.lastIndexOf(close);
        if (end <= start) {
            throw new SchemaValidationException("Unterminated JSON payload in model output");
        }

        return TRAILING_COMMA.matcher(cleaned.substring(start, end + 1)).replaceAll("$1");
    }
}
