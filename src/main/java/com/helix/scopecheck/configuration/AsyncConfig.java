package com.helix.scopecheck.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools of the pipeline.
 *
 * <p>Whole checks and the lookups inside a check run on separate pools; a check blocks while
 * its lookups run.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "scopeCheckExecutor")
    public ThreadPoolTaskExecutor scopeCheckExecutor() {
        return pool("scope-check-", 4, 8, 50);
    }

    @Bean(name = "fanOutExecutor")
    public ThreadPoolTaskExecutor fanOutExecutor() {
        return pool("fan-out-", 8, 24, 200);
    }

    private static ThreadPoolTaskExecutor pool(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("Executor {} configured: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }
}
