package dev.cvevaluator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured model output for the CV scoring stage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CvEvaluationOutput(
        @JsonProperty("technical_skills_match") CriterionScore technicalSkillsMatch,
        @JsonProperty("experience_level") CriterionScore experienceLevel,
        @JsonProperty("relevant_achievements") CriterionScore relevantAchievements,
        @JsonProperty("cultural_fit") CriterionScore culturalFit,
        @JsonProperty("overall_feedback") String overallFeedback,
        @JsonProperty("cv_recommendation") String recommendation) {

    public CriterionScore scoreFor(CvCriterion criterion) {
        return switch (criterion) {
            case TECHNICAL_SKILLS_MATCH -> technicalSkillsMatch;
            case EXPERIENCE_LEVEL -> experienceLevel;
            case RELEVANT_ACHIEVEMENTS -> relevantAchievements;
            case CULTURAL_FIT -> culturalFit;
        };
    }
}
