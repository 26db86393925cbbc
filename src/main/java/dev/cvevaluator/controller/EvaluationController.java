package dev.cvevaluator.controller;

import dev.cvevaluator.controller.dto.EvaluateRequest;
import dev.cvevaluator.controller.dto.EvaluateResponse;
import dev.cvevaluator.controller.dto.UploadResponse;
import dev.cvevaluator.document.DocumentStore;
import dev.cvevaluator.entity.CandidateDocument;
import dev.cvevaluator.entity.EvaluationJob;
import dev.cvevaluator.exception.ValidationException;
import dev.cvevaluator.model.DocumentType;
import dev.cvevaluator.model.JobView;
import dev.cvevaluator.service.EvaluationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * HTTP surface: upload a CV and project report, start an evaluation, poll its result.
 * Blocking store calls are moved off the event loop.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class EvaluationController {

    private final EvaluationService evaluationService;
    private final DocumentStore documentStore;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<UploadResponse> upload(@RequestPart(value = "cv", required = false) FilePart cv,
                                       @RequestPart(value = "project_report", required = false) FilePart projectReport) {
        if (cv == null || projectReport == null) {
            return Mono.error(new ValidationException("Both cv and project_report files are required"));
        }

        int maxBytes = (int) Math.min(documentStore.getMaxFileSize().toBytes(), Integer.MAX_VALUE);
        return Mono.zip(readBytes(cv, maxBytes), readBytes(projectReport, maxBytes))
                .publishOn(Schedulers.boundedElastic())
                .map(files -> {
                    documentStore.validateUpload(cv.filename(), files.getT1());
                    documentStore.validateUpload(projectReport.filename(), files.getT2());

                    CandidateDocument cvDocument = documentStore.upload(DocumentType.CV, cv.filename(), files.getT1());
                    CandidateDocument projectDocument = documentStore.upload(
                            DocumentType.PROJECT_REPORT, projectReport.filename(), files.getT2());
                    log.info("Uploaded CV {} and project report {}", cvDocument.getId(), projectDocument.getId());
                    return new UploadResponse(cvDocument.getId(), projectDocument.getId(), cvDocument.getUploadedAt());
                });
    }

    @PostMapping("/evaluate")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<EvaluateResponse> evaluate(@RequestBody EvaluateRequest request) {
        return Mono.fromCallable(() -> {
                    EvaluationJob job = evaluationService.createJob(
                            request.jobTitle(), request.cvId(), request.projectReportId());
                    return new EvaluateResponse(job.getId(), job.getStatus(), job.getCreatedAt());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/result/{id}")
    public Mono<JobView> result(@PathVariable String id) {
        return Mono.fromCallable(() -> evaluationService.getStatus(id))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Joins the part into memory, giving up as soon as it grows past {@code maxBytes}.
     */
    private Mono<byte[]> readBytes(FilePart part, int maxBytes) {
        return DataBufferUtils.join(part.content(), maxBytes)
                .onErrorMap(DataBufferLimitException.class, e -> new ValidationException(
                        "Uploaded file exceeds " + documentStore.getMaxFileSize() + ": " + part.filename()))
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0]);
    }
}
