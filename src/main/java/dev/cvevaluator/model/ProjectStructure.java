package dev.cvevaluator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectStructure(String structure, String implementation, String documentation) {

    public static final String NOT_SPECIFIED = "Not specified";

    public ProjectStructure {
        structure = orPlaceholder(structure);
        implementation = orPlaceholder(implementation);
        documentation = orPlaceholder(documentation);
    }

    public static ProjectStructure placeholder() {
        return new ProjectStructure(null, null, null);
    }

    private static String orPlaceholder(String value) {
        return value == null || value.isBlank() ? NOT_SPECIFIED : value;
    }
}
