package dev.cvevaluator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Final outcome of a completed evaluation.
 * {@code cvMatchRate} is normalized to [0, 1]; {@code projectScore} stays on the 1-5 scale.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationResult(
        @JsonProperty("cv_match_rate") double cvMatchRate,
        @JsonProperty("cv_feedback") String cvFeedback,
        @JsonProperty("cv_recommendation") String cvRecommendation,
        @JsonProperty("cv_scoring_breakdown") Map<String, WeightedScore> cvScoringBreakdown,
        @JsonProperty("project_score") double projectScore,
        @JsonProperty("project_feedback") String projectFeedback,
        @JsonProperty("project_recommendation") String projectRecommendation,
        @JsonProperty("project_scoring_breakdown") Map<String, WeightedScore> projectScoringBreakdown,
        @JsonProperty("overall_summary") String overallSummary) {

    public static EvaluationResult of(CvScoringResult cv, ProjectScoringResult project, String overallSummary) {
        return new EvaluationResult(
                cv.cvMatchRate(), cv.feedback(), cv.recommendation(), cv.breakdown(),
                project.projectScore(), project.feedback(), project.recommendation(), project.breakdown(),
                overallSummary);
    }
}
