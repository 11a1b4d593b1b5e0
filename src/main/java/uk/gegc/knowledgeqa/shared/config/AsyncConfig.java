package uk.gegc.knowledgeqa.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for blocking model and retrieval calls.
 *
 * Pipeline threads hand each call to this pool and wait on the returned future with a
 * timeout, so a hung provider never blocks a caller past its budget and a cancelled
 * caller can interrupt the call it is waiting on.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.ai.core-pool-size:4}")
    private int aiCorePoolSize;

    @Value("${async.ai.max-pool-size:16}")
    private int aiMaxPoolSize;

    @Value("${async.ai.queue-capacity:50}")
    private int aiQueueCapacity;

    @Value("${async.ai.keep-alive-seconds:60}")
    private int aiKeepAliveSeconds;

    @Bean(name = "aiCallExecutor")
    public AsyncTaskExecutor aiCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(aiCorePoolSize);
        executor.setMaxPoolSize(aiMaxPoolSize);
        executor.setQueueCapacity(aiQueueCapacity);
        executor.setKeepAliveSeconds(aiKeepAliveSeconds);
        executor.setThreadNamePrefix("ai-call-");

        // Reject when saturated; running on the caller's thread would escape the timeout
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // In-flight model calls are abandoned on shutdown rather than awaited
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("AI call executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                aiCorePoolSize, aiMaxPoolSize, aiQueueCapacity, aiKeepAliveSeconds);

        return executor;
    }
}
