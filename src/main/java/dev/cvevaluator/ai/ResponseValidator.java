package dev.cvevaluator.ai;

import dev.cvevaluator.exception.SchemaValidationException;
import dev.cvevaluator.model.CriterionScore;
import dev.cvevaluator.model.CvCriterion;
import dev.cvevaluator.model.CvEvaluationOutput;
import dev.cvevaluator.model.ProjectCriterion;
import dev.cvevaluator.model.ProjectEvaluationOutput;

/**
 * Range and completeness rules for scoring outputs.
 */
public final class ResponseValidator {

    static final int MIN_REASONING_LENGTH = 20;
    static final int MIN_FEEDBACK_LENGTH = 50;
    static final int MIN_RECOMMENDATION_LENGTH = 100;

    private ResponseValidator() {
    }

    public static void validateCvEvaluation(CvEvaluationOutput output) {
        for (CvCriterion criterion : CvCriterion.values()) {
            validateScore(criterion.key(), output.scoreFor(criterion));
        }
        requireLength("overall_feedback", output.overallFeedback(), MIN_FEEDBACK_LENGTH);
        requireLength("cv_recommendation", output.recommendation(), MIN_RECOMMENDATION_LENGTH);
    }

    public static void validateProjectEvaluation(ProjectEvaluationOutput output) {
        for (ProjectCriterion criterion : ProjectCriterion.values()) {
            validateScore(criterion.key(), output.scoreFor(criterion));
        }
        requireLength("overall_feedback", output.overallFeedback(), MIN_FEEDBACK_LENGTH);
        requireLength("project_recommendation", output.recommendation(), MIN_RECOMMENDATION_LENGTH);
    }

    private static void validateScore(String key, CriterionScore value) {
        if (value == null || value.score() == null) {
            throw new SchemaValidationException("Missing or invalid score for " + key);
        }
        if (value.score() < 1 || value.score() > 5) {
            throw new SchemaValidationException("Score out of range for " + key + ": " + value.score());
        }
        requireLength(key + ".reasoning", value.reasoning(), MIN_REASONING_LENGTH);
    }

    private static void requireLength(String field, String value, int minLength) {
        if (value == null || value.trim().length() < minLength) {
            throw new SchemaValidationException("Missing or insufficient " + field
                    + " (at least " + minLength + " characters required)");
        }
    }
}
