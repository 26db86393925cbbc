package dev.cvevaluator.controller;

import dev.cvevaluator.document.DocumentStore;
import dev.cvevaluator.entity.CandidateDocument;
import dev.cvevaluator.entity.EvaluationJob;
import dev.cvevaluator.exception.DocumentNotFoundException;
import dev.cvevaluator.exception.JobNotFoundException;
import dev.cvevaluator.exception.ValidationException;
import dev.cvevaluator.model.DocumentType;
import dev.cvevaluator.model.JobStatus;
import dev.cvevaluator.model.JobView;
import dev.cvevaluator.service.EvaluationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.BodyInserters;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Arrays;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@WebFluxTest(EvaluationController.class)
class EvaluationControllerTest {

    private static final byte[] PDF = "%PDF-1.7\n".getBytes(StandardCharsets.US_ASCII);

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private EvaluationService evaluationService;

    @MockitoBean
    private DocumentStore documentStore;

    private static ByteArrayResource pdf(String filename) {
        return file(filename, PDF);
    }

    private static ByteArrayResource file(String filename, byte[] content) {
        return new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return filename;
            }
        };
    }

    @Nested
    @DisplayName("POST /upload")
    class UploadTests {

        @BeforeEach
        void setUp() {
            when(documentStore.getMaxFileSize()).thenReturn(DataSize.ofBytes(64));
        }

        @Test
        @DisplayName("Should store both files and return their ids")
        void shouldUploadBothFiles() {
            LocalDateTime now = LocalDateTime.of(2026, 3, 1, 9, 30);
            when(documentStore.upload(eq(DocumentType.CV), eq("resume.pdf"), any())).thenReturn(
                    CandidateDocument.builder().id("cv_1").type(DocumentType.CV).uploadedAt(now).build());
            when(documentStore.upload(eq(DocumentType.PROJECT_REPORT), eq("report.pdf"), any())).thenReturn(
                    CandidateDocument.builder().id("project_report_1").type(DocumentType.PROJECT_REPORT)
                            .uploadedAt(now).build());

            MultipartBodyBuilder body = new MultipartBodyBuilder();
            body.part("cv", pdf("resume.pdf")).contentType(MediaType.APPLICATION_PDF);
            body.part("project_report", pdf("report.pdf")).contentType(MediaType.APPLICATION_PDF);

            webTestClient.post().uri("/upload")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(body.build()))
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.cv_id").isEqualTo("cv_1")
                    .jsonPath("$.project_report_id").isEqualTo("project_report_1")
                    .jsonPath("$.uploaded_at").exists();

            verify(documentStore).upload(DocumentType.CV, "resume.pdf", PDF);
        }

        @Test
        @DisplayName("Should reject a request without the project report")
        void shouldRejectMissingPart() {
            MultipartBodyBuilder body = new MultipartBodyBuilder();
            body.part("cv", pdf("resume.pdf")).contentType(MediaType.APPLICATION_PDF);

            webTestClient.post().uri("/upload")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(body.build()))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");

            verify(documentStore, never()).upload(any(), any(), any());
        }

        @Test
        @DisplayName("Should return 400 when a file is rejected")
        void shouldReturnBadRequestForRejectedFile() {
            when(documentStore.upload(any(), any(), any()))
                    .thenThrow(new ValidationException("Uploaded file is not a PDF: resume.pdf"));

            MultipartBodyBuilder body = new MultipartBodyBuilder();
            body.part("cv", pdf("resume.pdf"));
            body.part("project_report", pdf("report.pdf"));

            webTestClient.post().uri("/upload")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(body.build()))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Uploaded file is not a PDF: resume.pdf");
        }

        @Test
        @DisplayName("Should stop reading a part that exceeds the size limit")
        void shouldRejectOversizedPart() {
            byte[] oversized = Arrays.copyOf(PDF, 4096);

            MultipartBodyBuilder body = new MultipartBodyBuilder();
            body.part("cv", file("huge.pdf", oversized)).contentType(MediaType.APPLICATION_PDF);
            body.part("project_report", pdf("report.pdf")).contentType(MediaType.APPLICATION_PDF);

            webTestClient.post().uri("/upload")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(body.build()))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("VALIDATION_ERROR")
                    .jsonPath("$.message").isEqualTo("Uploaded file exceeds 64B: huge.pdf");

            verify(documentStore, never()).validateUpload(any(), any());
            verify(documentStore, never()).upload(any(), any(), any());
        }

        @Test
        @DisplayName("Should store nothing when the project report is rejected")
        void shouldNotStoreCvWhenProjectReportIsRejected() {
            doThrow(new ValidationException("Uploaded file is not a PDF: report.pdf"))
                    .when(documentStore).validateUpload(eq("report.pdf"), any());

            MultipartBodyBuilder body = new MultipartBodyBuilder();
            body.part("cv", pdf("resume.pdf")).contentType(MediaType.APPLICATION_PDF);
            body.part("project_report", pdf("report.pdf")).contentType(MediaType.APPLICATION_PDF);

            webTestClient.post().uri("/upload")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(body.build()))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Uploaded file is not a PDF: report.pdf");

            verify(documentStore).validateUpload("resume.pdf", PDF);
            verify(documentStore, never()).upload(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("POST /evaluate")
    class EvaluateTests {

        private static final String BODY = """
                {"job_title": "Backend Engineer", "cv_id": "cv_1", "project_report_id": "project_report_1"}""";

        @Test
        @DisplayName("Should accept the job and return it queued")
        void shouldAcceptJob() {
            when(evaluationService.createJob("Backend Engineer", "cv_1", "project_report_1"))
                    .thenReturn(EvaluationJob.builder()
                            .id("eval_job_1")
                            .status(JobStatus.QUEUED)
                            .createdAt(LocalDateTime.now())
                            .build());

            webTestClient.post().uri("/evaluate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(BODY)
                    .exchange()
                    .expectStatus().isAccepted()
                    .expectBody()
                    .jsonPath("$.id").isEqualTo("eval_job_1")
                    .jsonPath("$.status").isEqualTo("queued")
                    .jsonPath("$.created_at").exists();
        }

        @Test
        @DisplayName("Should return 400 for invalid submissions")
        void shouldReturnBadRequestForValidationErrors() {
            when(evaluationService.createJob(any(), any(), any()))
                    .thenThrow(new ValidationException("job_title is required"));

            webTestClient.post().uri("/evaluate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"cv_id\": \"cv_1\", \"project_report_id\": \"project_report_1\"}")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("VALIDATION_ERROR")
                    .jsonPath("$.message").isEqualTo("job_title is required");
        }

        @Test
        @DisplayName("Should return 400 for malformed JSON")
        void shouldReturnBadRequestForMalformedJson() {
            webTestClient.post().uri("/evaluate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{not json")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");

            verifyNoInteractions(evaluationService);
        }

        @Test
        @DisplayName("Should return 404 for unknown documents")
        void shouldReturnNotFoundForUnknownDocument() {
            when(evaluationService.createJob(any(), any(), any()))
                    .thenThrow(new DocumentNotFoundException("cv_1"));

            webTestClient.post().uri("/evaluate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(BODY)
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("DOCUMENT_NOT_FOUND");
        }
    }

    @Nested
    @DisplayName("GET /result/{id}")
    class ResultTests {

        @Test
        @DisplayName("Should return progress for a running job")
        void shouldReturnProgress() {
            when(evaluationService.getStatus("eval_job_1")).thenReturn(JobView.from(EvaluationJob.builder()
                    .id("eval_job_1")
                    .status(JobStatus.PROCESSING)
                    .currentStage("project_parsing")
                    .progressPercentage(50)
                    .createdAt(LocalDateTime.now())
                    .startedAt(LocalDateTime.now())
                    .build()));

            webTestClient.get().uri("/result/eval_job_1")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("processing")
                    .jsonPath("$.current_stage").isEqualTo("project_parsing")
                    .jsonPath("$.progress_percentage").isEqualTo(50)
                    .jsonPath("$.result").doesNotExist()
                    .jsonPath("$.error").doesNotExist();
        }

        @Test
        @DisplayName("Should return 404 for unknown jobs")
        void shouldReturnNotFoundForUnknownJob() {
            when(evaluationService.getStatus("eval_job_404")).thenThrow(new JobNotFoundException("eval_job_404"));

            webTestClient.get().uri("/result/eval_job_404")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("JOB_NOT_FOUND");
        }
    }
}
