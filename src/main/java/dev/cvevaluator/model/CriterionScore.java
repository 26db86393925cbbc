package dev.cvevaluator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CriterionScore(Double score, String reasoning) {
}
