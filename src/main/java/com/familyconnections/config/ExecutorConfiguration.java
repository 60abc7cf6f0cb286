package com.familyconnections.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for group analysis.
 *
 * <p>Pair scoring is CPU-bound and stateless, so a bounded platform thread
 * pool sized to the processor count is used. When the queue is full the
 * submitting thread scores the pair itself.
 */
@Configuration
@Slf4j
public class ExecutorConfiguration {

    public static final String SCORING_EXECUTOR = "scoringExecutor";

    @Bean(name = SCORING_EXECUTOR)
    public ThreadPoolTaskExecutor scoringExecutor(AnalysisProperties properties) {
        int threads = properties.getWorkerThreads();
        log.info("Configuring scoring executor with {} worker threads", threads);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("pair-scoring-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }
}
