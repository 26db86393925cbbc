package dev.cvevaluator.ai;

import dev.cvevaluator.model.CvEvaluationOutput;
import dev.cvevaluator.model.CvStructure;
import dev.cvevaluator.model.InjectionDetectionResult;
import dev.cvevaluator.model.ProjectEvaluationOutput;
import dev.cvevaluator.model.ProjectStructure;

import java.util.Map;

/**
 * Everything needed for one schema-validated generation: target type, response schema,
 * semantic validator, first-attempt model settings and the fallback escalation.
 */
public record StructuredOutputSpec<T>(
        String name,
        Class<T> type,
        Map<String, Object> schema,
        OutputValidator<T> validator,
        ModelTier tier,
        double temperature,
        int maxOutputTokens,
        FallbackPolicy fallback) {

    public static final StructuredOutputSpec<CvEvaluationOutput> CV_EVALUATION = new StructuredOutputSpec<>(
            "cv_evaluation", CvEvaluationOutput.class, OutputSchemas.CV_EVALUATION,
            ResponseValidator::validateCvEvaluation,
            ModelTier.PRIMARY, 0.3, 5000,
            new FallbackPolicy(ModelTier.FAST, 0.5, 5000));

    public static final StructuredOutputSpec<ProjectEvaluationOutput> PROJECT_EVALUATION = new StructuredOutputSpec<>(
            "project_evaluation", ProjectEvaluationOutput.class, OutputSchemas.PROJECT_EVALUATION,
            ResponseValidator::validateProjectEvaluation,
            ModelTier.PRIMARY, 0.3, 5000,
            new FallbackPolicy(ModelTier.FAST, 0.5, 5000));

    public static final StructuredOutputSpec<CvStructure> CV_STRUCTURE = new StructuredOutputSpec<>(
            "cv_structure", CvStructure.class, OutputSchemas.CV_STRUCTURE,
            OutputValidator.none(),
            ModelTier.FAST, 0.2, 4000,
            new FallbackPolicy(ModelTier.FAST, 0.3, 3000));

    public static final StructuredOutputSpec<ProjectStructure> PROJECT_STRUCTURE = new StructuredOutputSpec<>(
            "project_structure", ProjectStructure.class, OutputSchemas.PROJECT_STRUCTURE,
            OutputValidator.none(),
            ModelTier.FAST, 0.2, 4000,
            new FallbackPolicy(ModelTier.FAST, 0.3, 3000));

    public static final StructuredOutputSpec<InjectionDetectionResult> INJECTION_DETECTION = new StructuredOutputSpec<>(
            "injection_detection", InjectionDetectionResult.class, OutputSchemas.INJECTION_DETECTION,
            OutputValidator.none(),
            ModelTier.FAST, 0.2, 1000,
            new FallbackPolicy(ModelTier.FAST, 0.3, 1000));
}
