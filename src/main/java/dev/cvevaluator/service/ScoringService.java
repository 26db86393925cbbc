package dev.cvevaluator.service;

import dev.cvevaluator.exception.SchemaValidationException;
import dev.cvevaluator.model.CriterionScore;
import dev.cvevaluator.model.CvCriterion;
import dev.cvevaluator.model.CvEvaluationOutput;
import dev.cvevaluator.model.CvScoringResult;
import dev.cvevaluator.model.ProjectCriterion;
import dev.cvevaluator.model.ProjectEvaluationOutput;
import dev.cvevaluator.model.ProjectScoringResult;
import dev.cvevaluator.model.WeightedScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted aggregation of validated per-criterion scores.
 */
@Slf4j
@Service
public class ScoringService {

    private static final double MAX_SCORE = 5.0;

    /**
     * Score a CV evaluation.
     *
     * @return breakdown keyed by criterion plus a match rate normalized to [0, 1]
     */
    public CvScoringResult scoreCv(CvEvaluationOutput output) {
        Map<String, WeightedScore> breakdown = new LinkedHashMap<>();
        double total = 0.0;

        for (CvCriterion criterion : CvCriterion.values()) {
            WeightedScore weighted = WeightedScore.of(scoreOf(criterion.key(), output.scoreFor(criterion)),
                    criterion.weight());
            breakdown.put(criterion.key(), weighted);
            total += weighted.weightedScore();
        }

        double matchRate = total / MAX_SCORE;
        log.debug("CV weighted score {} -> match rate {}", total, matchRate);
        return new CvScoringResult(breakdown, matchRate, output.overallFeedback(), output.recommendation());
    }

    /**
     * Score a project evaluation. The project score stays on the 1-5 scale.
     */
    public ProjectScoringResult scoreProject(ProjectEvaluationOutput output) {
        Map<String, WeightedScore> breakdown = new LinkedHashMap<>();
        double total = 0.0;

        for (ProjectCriterion criterion : ProjectCriterion.values()) {
            WeightedScore weighted = WeightedScore.of(scoreOf(criterion.key(), output.scoreFor(criterion)),
                    criterion.weight());
            breakdown.put(criterion.key(), weighted);
            total += weighted.weightedScore();
        }

        log.debug("Project weighted score {}", total);
        return new ProjectScoringResult(breakdown, total, output.overallFeedback(), output.recommendation());
    }

    private static double scoreOf(String key, CriterionScore criterionScore) {
        if (criterionScore == null || criterionScore.score() == null) {
            throw new SchemaValidationException("Missing score for " + key);
        }
        return criterionScore.score();
    }
}
