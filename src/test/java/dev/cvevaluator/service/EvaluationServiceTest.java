package dev.cvevaluator.service;

import dev.cvevaluator.document.DocumentStore;
import dev.cvevaluator.entity.CandidateDocument;
import dev.cvevaluator.entity.EvaluationJob;
import dev.cvevaluator.exception.DocumentNotFoundException;
import dev.cvevaluator.exception.ValidationException;
import dev.cvevaluator.metrics.EvaluationMetrics;
import dev.cvevaluator.model.DocumentType;
import dev.cvevaluator.model.JobStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EvaluationServiceTest {

    @Mock
    private DocumentStore documentStore;

    @Mock
    private EvaluationJobStore jobStore;

    @Mock
    private EvaluationQueue queue;

    private SimpleMeterRegistry meterRegistry;
    private EvaluationService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new EvaluationService(documentStore, jobStore, queue, new EvaluationMetrics(meterRegistry));
    }

    private void stubDocument(String id, DocumentType type) {
        when(documentStore.get(id)).thenReturn(CandidateDocument.builder()
                .id(id)
                .type(type)
                .filename(id + ".pdf")
                .storagePath("/tmp/" + id + ".pdf")
                .uploadedAt(LocalDateTime.now())
                .build());
    }

    @Nested
    @DisplayName("Create job")
    class CreateJobTests {

        @Test
        @DisplayName("Should persist, enqueue and count a valid submission")
        void shouldCreateAndEnqueue() {
            stubDocument("cv_1", DocumentType.CV);
            stubDocument("project_report_1", DocumentType.PROJECT_REPORT);
            EvaluationJob created = EvaluationJob.builder()
                    .id("eval_job_1")
                    .status(JobStatus.QUEUED)
                    .createdAt(LocalDateTime.now())
                    .build();
            when(jobStore.create("Backend Engineer", "cv_1", "project_report_1")).thenReturn(created);

            EvaluationJob job = service.createJob("  Backend Engineer ", "cv_1", "project_report_1");

            assertThat(job).isSameAs(created);
            verify(queue).enqueue("eval_job_1");
            assertThat(meterRegistry.get("cv_evaluator_jobs_enqueued_total").counter().count()).isEqualTo(1.0);
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   "})
        @DisplayName("Should reject a missing job title")
        void shouldRejectMissingTitle(String title) {
            assertThatThrownBy(() -> service.createJob(title, "cv_1", "project_report_1"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("job_title is required");
            verifyNoInteractions(jobStore, queue);
        }

        @Test
        @DisplayName("Should reject a missing CV id")
        void shouldRejectMissingCvId() {
            assertThatThrownBy(() -> service.createJob("Backend Engineer", "", "project_report_1"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("cv_id is required");
        }

        @Test
        @DisplayName("Should reject documents of the wrong type")
        void shouldRejectWrongDocumentType() {
            stubDocument("cv_1", DocumentType.CV);
            stubDocument("cv_2", DocumentType.CV);

            assertThatThrownBy(() -> service.createJob("Backend Engineer", "cv_1", "cv_2"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("project_report_id must reference a project_report document");
            verify(jobStore, never()).create(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("Should propagate unknown document ids")
        void shouldPropagateUnknownDocument() {
            when(documentStore.get("cv_404")).thenThrow(new DocumentNotFoundException("cv_404"));

            assertThatThrownBy(() -> service.createJob("Backend Engineer", "cv_404", "project_report_1"))
                    .isInstanceOf(DocumentNotFoundException.class);
            verifyNoInteractions(queue);
        }
    }
}
