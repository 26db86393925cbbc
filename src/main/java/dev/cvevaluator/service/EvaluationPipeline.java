package dev.cvevaluator.service;

import dev.cvevaluator.ai.GenerationClient;
import dev.cvevaluator.ai.GenerationResponse;
import dev.cvevaluator.ai.ModelTier;
import dev.cvevaluator.ai.StructuredOutputSpec;
import dev.cvevaluator.document.DocumentStore;
import dev.cvevaluator.document.TextExtractor;
import dev.cvevaluator.entity.CandidateDocument;
import dev.cvevaluator.exception.SecurityBlockedException;
import dev.cvevaluator.exception.StageFailedException;
import dev.cvevaluator.metrics.EvaluationMetrics;
import dev.cvevaluator.model.CvEvaluationOutput;
import dev.cvevaluator.model.CvScoringResult;
import dev.cvevaluator.model.CvStructure;
import dev.cvevaluator.model.DocumentType;
import dev.cvevaluator.model.EvaluationResult;
import dev.cvevaluator.model.EvaluationStage;
import dev.cvevaluator.model.InjectionDetectionResult;
import dev.cvevaluator.model.ParsedContent;
import dev.cvevaluator.model.ParsedCv;
import dev.cvevaluator.model.ParsedProject;
import dev.cvevaluator.model.ProjectEvaluationOutput;
import dev.cvevaluator.model.ProjectScoringResult;
import dev.cvevaluator.model.ProjectStructure;
import dev.cvevaluator.model.RetrievedChunk;
import dev.cvevaluator.model.ScreeningResult;
import dev.cvevaluator.model.SensitivityProfile;
import dev.cvevaluator.rag.RetrievalClient;
import dev.cvevaluator.security.InjectionDetector;
import dev.cvevaluator.security.SafetyScreener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs one evaluation job through its stages in order:
 * cv_parsing, cv_evaluation, project_parsing, project_evaluation, synthesis, completing.
 *
 * <p>Each stage commits its progress checkpoint before doing any work. Any error raised inside a
 * stage fails the whole job with the stage recorded; degraded results (empty retrieval, failed
 * structuring, empty or blocked synthesis) are substituted and the job continues.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationPipeline {

    static final String FALLBACK_SUMMARY =
            "Summary generation completed. Please review the detailed evaluation results.";

    static final String JOB_DESCRIPTION_NAMESPACE = "job_descriptions";
    static final String CASE_STUDY_NAMESPACE = "case_studies";
    static final String RUBRIC_NAMESPACE = "scoring_rubrics";

    private static final int REQUIREMENTS_TOP_K = 5;
    private static final int RUBRIC_TOP_K = 3;
    private static final double SYNTHESIS_TEMPERATURE = 0.4;
    private static final int SYNTHESIS_MAX_TOKENS = 2000;

    private static final String SOURCE_FILE = "file";
    private static final String SOURCE_INJECTION = "injection";
    private static final String SOURCE_PROMPT = "prompt";
    private static final String SOURCE_RESPONSE = "response";

    private final EvaluationJobStore jobStore;
    private final DocumentStore documentStore;
    private final TextExtractor textExtractor;
    private final SafetyScreener safetyScreener;
    private final InjectionDetector injectionDetector;
    private final GenerationClient generationClient;
    private final RetrievalClient retrievalClient;
    private final ScoringService scoringService;
    private final EvaluationMetrics metrics;

    /**
     * Execute the job to a terminal state. Failures are recorded on the job, not thrown.
     */
    public void run(String jobId) {
        EvaluationRun run = new EvaluationRun(jobStore.get(jobId));
        log.info("Evaluating job {} for '{}'", jobId, run.getJobTitle());

        try {
            ParsedCv cv = runStage(run, EvaluationStage.CV_PARSING, () -> parseCv(run));
            CvScoringResult cvScore = runStage(run, EvaluationStage.CV_EVALUATION, () -> evaluateCv(run, cv));
            ParsedProject project = runStage(run, EvaluationStage.PROJECT_PARSING, () -> parseProject(run));
            ProjectScoringResult projectScore = runStage(run, EvaluationStage.PROJECT_EVALUATION,
                    () -> evaluateProject(run, project));
            String summary = runStage(run, EvaluationStage.SYNTHESIS, () -> synthesize(run, cvScore, projectScore));

            runStage(run, EvaluationStage.COMPLETING, () -> {
                jobStore.complete(jobId, EvaluationResult.of(cvScore, projectScore, summary), run.toMetadata());
                return null;
            });

            metrics.recordJobCompleted();
            log.info("Job {} completed: cv_match_rate={}, project_score={}, llm_calls={}, retries={}, fallbacks={}",
                    jobId, String.format("%.2f", cvScore.cvMatchRate()), String.format("%.2f", projectScore.projectScore()),
                    run.getUsage().getLlmCalls(), run.getUsage().getRetries(), run.getUsage().getFallbacks());
        } catch (StageFailedException e) {
            if (e.getCause() instanceof InterruptedException) {
                log.warn("Job {} interrupted during {}; leaving the outcome to the worker", jobId,
                        e.getStage().getLabel());
                Thread.currentThread().interrupt();
                return;
            }
            log.error("Job {} failed at {} [{}]: {}", jobId, e.getStage().getLabel(), e.getErrorCode(),
                    e.getMessage(), e.getCause());
            jobStore.fail(jobId, e.getErrorCode(), e.getMessage(), e.getStage().getLabel());
            metrics.recordJobFailed(e.getErrorCode());
        }
    }

    private <T> T runStage(EvaluationRun run, EvaluationStage stage, Supplier<T> work) {
        long start = System.nanoTime();
        try {
            jobStore.enterStage(run.getJobId(), stage);
            log.info("Job {} -> {} ({}%)", run.getJobId(), stage.getLabel(), stage.getProgress());
            return work.get();
        } catch (RuntimeException e) {
            throw new StageFailedException(stage, Exceptions.unwrap(e));
        } finally {
            metrics.recordStageDuration(stage.getLabel(), Duration.ofNanos(System.nanoTime() - start));
        }
    }

    // --- parsing ---

    private ParsedCv parseCv(EvaluationRun run) {
        String text = loadScreenedText(run, run.getCvDocumentId(), SensitivityProfile.CV);
        if (text.isBlank()) {
            log.warn("CV {} has no extractable text", run.getCvDocumentId());
            return new ParsedCv(text, CvStructure.empty());
        }

        CvStructure structure = run.await(generationClient
                .generateStructured(PromptTemplates.CV_STRUCTURE_SYSTEM, PromptTemplates.cvStructureUser(text),
                        StructuredOutputSpec.CV_STRUCTURE)
                .onErrorResume(e -> {
                    log.warn("CV structuring failed, continuing with an empty structure: {}", e.getMessage());
                    return Mono.just(CvStructure.empty());
                }));
        return new ParsedCv(text, structure);
    }

    private ParsedProject parseProject(EvaluationRun run) {
        String text = loadScreenedText(run, run.getProjectReportDocumentId(), SensitivityProfile.PROJECT);
        if (text.isBlank()) {
            log.warn("Project report {} has no extractable text", run.getProjectReportDocumentId());
            return new ParsedProject(text, ProjectStructure.placeholder());
        }

        ProjectStructure structure = run.await(generationClient
                .generateStructured(PromptTemplates.PROJECT_STRUCTURE_SYSTEM,
                        PromptTemplates.projectStructureUser(text), StructuredOutputSpec.PROJECT_STRUCTURE)
                .onErrorResume(e -> {
                    log.warn("Project structuring failed, continuing with placeholders: {}", e.getMessage());
                    return Mono.just(ProjectStructure.placeholder());
                }));
        return new ParsedProject(text, structure);
    }

    /**
     * Screen the stored file, extract (or reuse cached) text and run injection detection on it.
     */
    private String loadScreenedText(EvaluationRun run, String documentId, SensitivityProfile profile) {
        CandidateDocument document = documentStore.get(documentId);
        byte[] content = documentStore.readContent(document);

        ScreeningResult fileVerdict = run.await(safetyScreener.screenFile(content, document.getMimeType()));
        if (fileVerdict.blocked()) {
            metrics.recordSecurityBlock(SOURCE_FILE);
            throw new SecurityBlockedException(profile.getDocumentLabel() + " blocked by security screening: "
                    + String.join(", ", fileVerdict.reasons()), fileVerdict.reasons());
        }

        String text;
        if (document.hasParsedContent()) {
            log.debug("Using cached text for document {}", documentId);
            text = document.getParsedText();
        } else {
            ParsedContent parsed = run.await(textExtractor.extract(content, document.getMimeType()));
            documentStore.cacheParsedContent(documentId, parsed);
            log.info("Extracted {} characters ({} pages) from {}", parsed.text().length(), parsed.pages(), documentId);
            text = parsed.text();
        }

        InjectionDetectionResult detection = run.await(injectionDetector.detect(text, profile));
        if (profile.shouldBlock(detection)) {
            metrics.recordSecurityBlock(SOURCE_INJECTION);
            throw new SecurityBlockedException(InjectionDetector.blockMessage(detection, profile),
                    detection.reason() != null ? List.of(detection.reason()) : List.of());
        }
        if (detection.detected()) {
            run.getUsage().recordSecurityWarning();
            log.warn("{} {} has a sub-threshold injection signal ({} severity, confidence {}); continuing",
                    profile.getDocumentLabel(), documentId, detection.severity().getValue(), detection.confidence());
        }
        return text;
    }

    // --- scoring ---

    private CvScoringResult evaluateCv(EvaluationRun run, ParsedCv cv) {
        Tuple2<List<RetrievedChunk>, List<RetrievedChunk>> context = run.await(Mono.zip(
                retrievalClient.query("Backend development experience with " + run.getJobTitle() + " requirements",
                        Map.of("document_type", DocumentType.JOB_DESCRIPTION.getValue(),
                                "job_title", run.getJobTitle()),
                        REQUIREMENTS_TOP_K, JOB_DESCRIPTION_NAMESPACE),
                retrievalClient.query("CV scoring rubric evaluation criteria",
                        Map.of("document_type", DocumentType.CV_SCORING_RUBRIC.getValue()),
                        RUBRIC_TOP_K, RUBRIC_NAMESPACE)));

        String systemPrompt = PromptTemplates.cvEvaluationSystem(
                run.getJobTitle(), join(context.getT2()), join(context.getT1()));
        String userPrompt = PromptTemplates.cvEvaluationUser(cv.rawText(), cv.structure());
        screenPrompts(run, systemPrompt, userPrompt);

        CvEvaluationOutput output = run.await(generationClient.generateStructured(
                systemPrompt, userPrompt, StructuredOutputSpec.CV_EVALUATION));
        CvScoringResult result = scoringService.scoreCv(output);
        log.info("Job {} CV match rate {}", run.getJobId(), String.format("%.2f", result.cvMatchRate()));
        return result;
    }

    private ProjectScoringResult evaluateProject(EvaluationRun run, ParsedProject project) {
        Tuple2<List<RetrievedChunk>, List<RetrievedChunk>> context = run.await(Mono.zip(
                retrievalClient.query("case study requirements project implementation",
                        Map.of("document_type", DocumentType.CASE_STUDY_BRIEF.getValue()),
                        REQUIREMENTS_TOP_K, CASE_STUDY_NAMESPACE),
                retrievalClient.query("project scoring rubric evaluation criteria",
                        Map.of("document_type", DocumentType.PROJECT_SCORING_RUBRIC.getValue()),
                        RUBRIC_TOP_K, RUBRIC_NAMESPACE)));

        String systemPrompt = PromptTemplates.projectEvaluationSystem(
                run.getJobTitle(), join(context.getT1()), join(context.getT2()));
        String userPrompt = PromptTemplates.projectEvaluationUser(project.rawText(), project.structure());
        screenPrompts(run, systemPrompt, userPrompt);

        ProjectEvaluationOutput output = run.await(generationClient.generateStructured(
                systemPrompt, userPrompt, StructuredOutputSpec.PROJECT_EVALUATION));
        ProjectScoringResult result = scoringService.scoreProject(output);
        log.info("Job {} project score {}", run.getJobId(), String.format("%.2f", result.projectScore()));
        return result;
    }

    // --- synthesis ---

    private String synthesize(EvaluationRun run, CvScoringResult cv, ProjectScoringResult project) {
        String systemPrompt = PromptTemplates.synthesisSystem(
                cv.cvMatchRate(), cv.feedback(), project.projectScore(), project.feedback());
        String userPrompt = PromptTemplates.synthesisUser(
                cv.cvMatchRate(), cv.feedback(), project.projectScore(), project.feedback());
        screenPrompts(run, systemPrompt, userPrompt);

        GenerationResponse response = run.await(generationClient.generateText(
                systemPrompt, userPrompt, ModelTier.PRIMARY, SYNTHESIS_TEMPERATURE, SYNTHESIS_MAX_TOKENS));
        if (response == null || response.isEmpty()) {
            log.warn("Synthesis returned no text for job {}; using fallback summary", run.getJobId());
            return FALLBACK_SUMMARY;
        }

        String summary = response.text().trim();
        ScreeningResult verdict = run.await(safetyScreener.screenResponse(summary));
        if (verdict.blocked()) {
            metrics.recordSecurityBlock(SOURCE_RESPONSE);
            log.warn("Synthesis output for job {} blocked ({}); using fallback summary", run.getJobId(),
                    String.join(", ", verdict.reasons()));
            return FALLBACK_SUMMARY;
        }
        return summary;
    }

    private void screenPrompts(EvaluationRun run, String systemPrompt, String userPrompt) {
        Tuple2<ScreeningResult, ScreeningResult> verdicts = run.await(Mono.zip(
                safetyScreener.screenPrompt(systemPrompt), safetyScreener.screenPrompt(userPrompt)));

        if (verdicts.getT1().blocked() || verdicts.getT2().blocked()) {
            List<String> reasons = new ArrayList<>(verdicts.getT1().reasons());
            reasons.addAll(verdicts.getT2().reasons());
            metrics.recordSecurityBlock(SOURCE_PROMPT);
            throw new SecurityBlockedException("Prompts blocked by security screening: "
                    + String.join(", ", reasons), reasons);
        }
    }

    private static String join(List<RetrievedChunk> chunks) {
        return chunks.stream()
                .map(RetrievedChunk::content)
                .filter(content -> !content.isBlank())
                .collect(Collectors.joining("\n\n"));
    }
}
