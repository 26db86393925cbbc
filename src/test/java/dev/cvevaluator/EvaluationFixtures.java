package dev.cvevaluator;

import dev.cvevaluator.model.CriterionScore;
import dev.cvevaluator.model.CvEvaluationOutput;
import dev.cvevaluator.model.ProjectEvaluationOutput;

/**
 * Model outputs that pass the scoring validators.
 */
public final class EvaluationFixtures {

    public static final String REASONING = "Solid evidence found in the submitted material.";
    public static final String FEEDBACK =
            "The candidate shows strong backend fundamentals with room to grow in cloud operations.";
    public static final String RECOMMENDATION =
            "Quantify the impact of each listed project, add links to public repositories, and describe "
                    + "the scale of the systems you operated in production.";

    private EvaluationFixtures() {
    }

    public static CriterionScore score(double value) {
        return new CriterionScore(value, REASONING);
    }

    public static CvEvaluationOutput createCvOutput(double skills, double experience, double achievements,
                                                    double culture) {
        return new CvEvaluationOutput(score(skills), score(experience), score(achievements), score(culture),
                FEEDBACK, RECOMMENDATION);
    }

    public static ProjectEvaluationOutput createProjectOutput(double correctness, double quality, double resilience,
                                                              double documentation, double creativity) {
        return new ProjectEvaluationOutput(score(correctness), score(quality), score(resilience),
                score(documentation), score(creativity), FEEDBACK, RECOMMENDATION);
    }

    public static String cvOutputJson(int score) {
        return """
                {
                  "technical_skills_match": {"score": %1$d, "reasoning": "%2$s"},
                  "experience_level": {"score": %1$d, "reasoning": "%2$s"},
                  "relevant_achievements": {"score": %1$d, "reasoning": "%2$s"},
                  "cultural_fit": {"score": %1$d, "reasoning": "%2$s"},
                  "overall_feedback": "%3$s",
                  "cv_recommendation": "%4$s"
                }""".formatted(score, REASONING, FEEDBACK, RECOMMENDATION);
    }
}
