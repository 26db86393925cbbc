package dev.cvevaluator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for evaluation jobs. One thread per concurrent job; excess jobs wait in the
 * executor's queue in submission order.
 */
@Configuration
public class TaskExecutorConfig {

    public static final String EVALUATION_EXECUTOR = "evaluationTaskExecutor";

    @Bean(EVALUATION_EXECUTOR)
    public AsyncTaskExecutor evaluationTaskExecutor(QueueProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getConcurrency());
        executor.setMaxPoolSize(properties.getConcurrency());
        executor.setThreadNamePrefix("eval-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
