package dev.cvevaluator.ai;

import dev.cvevaluator.model.CvCriterion;
import dev.cvevaluator.model.ProjectCriterion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response schemas sent with structured generation calls, in the OpenAPI subset the
 * generateContent endpoint accepts.
 */
public final class OutputSchemas {

    public static final Map<String, Object> CV_EVALUATION = evaluation(
            Arrays.stream(CvCriterion.values()).map(CvCriterion::key).toList(), "cv_recommendation");

    public static final Map<String, Object> PROJECT_EVALUATION = evaluation(
            Arrays.stream(ProjectCriterion.values()).map(ProjectCriterion::key).toList(), "project_recommendation");

    public static final Map<String, Object> CV_STRUCTURE = object(
            props(
                    "name", string(),
                    "experience", array(object(props(
                            "title", string(),
                            "company", string(),
                            "duration", string(),
                            "description", string()), List.of("title", "company"))),
                    "skills", array(string()),
                    "education", array(object(props(
                            "degree", string(),
                            "institution", string(),
                            "year", nullable(string())), List.of("degree", "institution"))),
                    "achievements", array(string())),
            List.of("experience", "skills", "education", "achievements"));

    public static final Map<String, Object> PROJECT_STRUCTURE = object(
            props(
                    "structure", string(),
                    "implementation", string(),
                    "documentation", string()),
            List.of("structure", "implementation", "documentation"));

    public static final Map<String, Object> INJECTION_DETECTION = object(
            props(
                    "detected", Map.of("type", "BOOLEAN"),
                    "severity", Map.of("type", "STRING", "enum", List.of("low", "medium", "high", "critical")),
                    "confidence", Map.of("type", "NUMBER"),
                    "reason", string(),
                    "suspicious_sections", array(object(props(
                            "text", string(),
                            "start_index", Map.of("type", "INTEGER"),
                            "end_index", Map.of("type", "INTEGER")), List.of("text")))),
            List.of("detected", "severity", "confidence", "reason"));

    private OutputSchemas() {
    }

    private static Map<String, Object> evaluation(List<String> criteria, String recommendationKey) {
        Map<String, Object> properties = new LinkedHashMap<>();
        Map<String, Object> criterion = object(props(
                "score", Map.of("type", "NUMBER"),
                "reasoning", string()), List.of("score", "reasoning"));
        criteria.forEach(key -> properties.put(key, criterion));
        properties.put("overall_feedback", string());
        properties.put(recommendationKey, string());

        List<String> required = new ArrayList<>(criteria);
        required.add("overall_feedback");
        required.add(recommendationKey);
        return object(properties, required);
    }

    private static Map<String, Object> object(Map<String, Object> properties, List<String> required) {
        return Map.of("type", "OBJECT", "properties", properties, "required", required);
    }

    private static Map<String, Object> array(Map<String, Object> items) {
        return Map.of("type", "ARRAY", "items", items);
    }

    private static Map<String, Object> string() {
        return Map.of("type", "STRING");
    }

    private static Map<String, Object> nullable(Map<String, Object> schema) {
        Map<String, Object> copy = new LinkedHashMap<>(schema);
        copy.put("nullable", true);
        return copy;
    }

    private static Map<String, Object> props(Object... keyValues) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.put((String) keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }
}
