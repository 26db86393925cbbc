package dev.cvevaluator.service;

import dev.cvevaluator.document.DocumentStore;
import dev.cvevaluator.entity.CandidateDocument;
import dev.cvevaluator.entity.EvaluationJob;
import dev.cvevaluator.exception.ValidationException;
import dev.cvevaluator.metrics.EvaluationMetrics;
import dev.cvevaluator.model.DocumentType;
import dev.cvevaluator.model.JobView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for submitting evaluations and reading their state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    private final DocumentStore documentStore;
    private final EvaluationJobStore jobStore;
    private final EvaluationQueue queue;
    private final EvaluationMetrics metrics;

    /**
     * Validate the submission, persist a queued job and hand it to the worker pool.
     *
     * @return the created job
     * @throws ValidationException if the title is blank or a document has the wrong type
     * @throws dev.cvevaluator.exception.DocumentNotFoundException if a document id is unknown
     */
    public EvaluationJob createJob(String jobTitle, String cvDocumentId, String projectReportDocumentId) {
        if (jobTitle == null || jobTitle.isBlank()) {
            throw new ValidationException("job_title is required");
        }
        requireDocument(cvDocumentId, DocumentType.CV, "cv_id");
        requireDocument(projectReportDocumentId, DocumentType.PROJECT_REPORT, "project_report_id");

        EvaluationJob job = jobStore.create(jobTitle.trim(), cvDocumentId, projectReportDocumentId);
        queue.enqueue(job.getId());
        metrics.recordJobEnqueued();
        return job;
    }

    public JobView getStatus(String jobId) {
        return jobStore.view(jobId);
    }

    private void requireDocument(String documentId, DocumentType expected, String field) {
        if (documentId == null || documentId.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        CandidateDocument document = documentStore.get(documentId);
        if (document.getType() != expected) {
            throw new ValidationException(String.format("%s must reference a %s document, got %s",
                    field, expected.getValue(), document.getType().getValue()));
        }
    }
}
