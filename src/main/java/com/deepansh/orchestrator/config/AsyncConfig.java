package com.deepansh.orchestrator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool the chat streams run on.
 *
 * The servlet thread returns as soon as the SseEmitter is handed back; the
 * pipeline, its model calls and the token pacing all happen here. Beyond
 * the queue, submissions are aborted and the caller answers with an error event.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "pipelineTaskExecutor")
    public ThreadPoolTaskExecutor pipelineTaskExecutor(OrchestratorProperties properties) {
        OrchestratorProperties.Stream stream = properties.getStream();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(stream.getWorkers());
        executor.setMaxPoolSize(Math.max(stream.getWorkers(), stream.getMaxWorkers()));
        executor.setQueueCapacity(stream.getQueueCapacity());
        executor.setThreadNamePrefix("pipeline-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        // in-flight streams get a chance to finish their turn on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Pipeline pool ready [workers={}, maxWorkers={}, queue={}]",
                stream.getWorkers(), stream.getMaxWorkers(), stream.getQueueCapacity());
        return executor;
    }
}
