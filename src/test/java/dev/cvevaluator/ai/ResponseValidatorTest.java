package dev.cvevaluator.ai;

import dev.cvevaluator.exception.SchemaValidationException;
import dev.cvevaluator.model.CriterionScore;
import dev.cvevaluator.model.CvEvaluationOutput;
import dev.cvevaluator.model.ProjectEvaluationOutput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static dev.cvevaluator.EvaluationFixtures.FEEDBACK;
import static dev.cvevaluator.EvaluationFixtures.RECOMMENDATION;
import static dev.cvevaluator.EvaluationFixtures.createCvOutput;
import static dev.cvevaluator.EvaluationFixtures.createProjectOutput;
import static dev.cvevaluator.EvaluationFixtures.score;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseValidatorTest {

    @Test
    @DisplayName("Should accept complete outputs")
    void shouldAcceptCompleteOutputs() {
        assertThatCode(() -> ResponseValidator.validateCvEvaluation(createCvOutput(1, 2, 3, 5)))
                .doesNotThrowAnyException();
        assertThatCode(() -> ResponseValidator.validateProjectEvaluation(createProjectOutput(5, 4, 3, 2, 1)))
                .doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.99, 5.01, 10.0})
    @DisplayName("Should reject scores outside 1-5")
    void shouldRejectOutOfRangeScores(double value) {
        CvEvaluationOutput output = createCvOutput(3, value, 3, 3);

        assertThatThrownBy(() -> ResponseValidator.validateCvEvaluation(output))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("experience_level");
    }

    @Test
    @DisplayName("Should reject reasoning that is too short")
    void shouldRejectShortReasoning() {
        CvEvaluationOutput output = new CvEvaluationOutput(new CriterionScore(4.0, "Good."), score(3), score(3),
                score(3), FEEDBACK, RECOMMENDATION);

        assertThatThrownBy(() -> ResponseValidator.validateCvEvaluation(output))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("technical_skills_match.reasoning");
    }

    @Test
    @DisplayName("Should reject a missing recommendation")
    void shouldRejectMissingRecommendation() {
        ProjectEvaluationOutput output = new ProjectEvaluationOutput(score(4), score(4), score(4), score(4),
                score(4), FEEDBACK, "Add tests.");

        assertThatThrownBy(() -> ResponseValidator.validateProjectEvaluation(output))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("project_recommendation");
    }

    @Test
    @DisplayName("Should reject short overall feedback")
    void shouldRejectShortFeedback() {
        CvEvaluationOutput output = new CvEvaluationOutput(score(4), score(4), score(4), score(4),
                "Fine.", RECOMMENDATION);

        assertThatThrownBy(() -> ResponseValidator.validateCvEvaluation(output))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("overall_feedback");
    }
}
