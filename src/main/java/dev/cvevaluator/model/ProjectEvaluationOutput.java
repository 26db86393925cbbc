package dev.cvevaluator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured model output for the project scoring stage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectEvaluationOutput(
        CriterionScore correctness,
        @JsonProperty("code_quality") CriterionScore codeQuality,
        CriterionScore resilience,
        CriterionScore documentation,
        CriterionScore creativity,
        @JsonProperty("overall_feedback") String overallFeedback,
        @JsonProperty("project_recommendation") String recommendation) {

    public CriterionScore scoreFor(ProjectCriterion criterion) {
        return switch (criterion) {
            case CORRECTNESS -> correctness;
            case CODE_QUALITY -> codeQuality;
            case RESILIENCE -> resilience;
            case DOCUMENTATION -> documentation;
            case CREATIVITY -> creativity;
        };
    }
}
