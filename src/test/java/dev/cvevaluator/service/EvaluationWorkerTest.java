package dev.cvevaluator.service;

import dev.cvevaluator.config.QueueProperties;
import dev.cvevaluator.entity.EvaluationJob;
import dev.cvevaluator.metrics.EvaluationMetrics;
import dev.cvevaluator.model.JobStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EvaluationWorkerTest {

    private static final String JOB_ID = "eval_job_1";

    @Mock
    private EvaluationPipeline pipeline;

    @Mock
    private EvaluationJobStore jobStore;

    private SimpleMeterRegistry meterRegistry;
    private QueueProperties properties;
    private EvaluationWorker worker;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new QueueProperties();
        properties.setJobTimeout(Duration.ofSeconds(5));
        worker = new EvaluationWorker(pipeline, jobStore, new EvaluationMetrics(meterRegistry), properties);
    }

    private double activeJobs() {
        return meterRegistry.get("cv_evaluator_jobs_active").gauge().value();
    }

    @Test
    @DisplayName("Should run the pipeline for a queued job")
    void shouldRunPipeline() {
        when(jobStore.isTerminal(JOB_ID)).thenReturn(false);

        worker.process(JOB_ID);

        verify(pipeline).run(JOB_ID);
        assertThat(activeJobs()).isZero();
    }

    @Test
    @DisplayName("Should skip a job that already finished")
    void shouldSkipTerminalJob() {
        when(jobStore.isTerminal(JOB_ID)).thenReturn(true);

        worker.process(JOB_ID);

        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("Should fail the job with JOB_TIMEOUT at its current stage")
    void shouldFailOnTimeout() {
        properties.setJobTimeout(Duration.ofMillis(100));
        when(jobStore.isTerminal(JOB_ID)).thenReturn(false);
        when(jobStore.get(JOB_ID)).thenReturn(EvaluationJob.builder()
                .id(JOB_ID)
                .status(JobStatus.PROCESSING)
                .currentStage("project_evaluation")
                .build());
        doAnswer(invocation -> {
            Thread.sleep(2_000);
            return null;
        }).when(pipeline).run(JOB_ID);

        worker.process(JOB_ID);

        verify(jobStore).fail(eq(JOB_ID), eq("JOB_TIMEOUT"), startsWith("Job exceeded"), eq("project_evaluation"));
        assertThat(meterRegistry.get("cv_evaluator_jobs_failed_total").tag("code", "JOB_TIMEOUT").counter().count())
                .isEqualTo(1.0);
        assertThat(activeJobs()).isZero();
    }

    @Test
    @DisplayName("Should rethrow unexpected errors to the queue")
    void shouldRethrowUnexpectedErrors() {
        when(jobStore.isTerminal(JOB_ID)).thenReturn(false);
        doThrow(new IllegalStateException("database unavailable")).when(pipeline).run(JOB_ID);

        assertThatThrownBy(() -> worker.process(JOB_ID))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("database unavailable");
        verify(jobStore, never()).fail(anyString(), anyString(), anyString(), anyString());
        assertThat(activeJobs()).isZero();
    }
}
