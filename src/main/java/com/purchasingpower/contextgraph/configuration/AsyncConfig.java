package com.purchasingpower.contextgraph.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools of the engine.
 *
 * <ul>
 *   <li>{@code compressionExecutor} - bounded pool for batch compression chunks</li>
 *   <li>{@code mirrorExecutor} - single thread replaying graph mutations onto the persistent store</li>
 * </ul>
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "compressionExecutor")
    public Executor compressionExecutor(BatchProperties batch) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batch.getPoolSize());
        executor.setMaxPoolSize(batch.getPoolSize());
        executor.setQueueCapacity(batch.getQueueCapacity());
        executor.setThreadNamePrefix("compression-");

        // Wait for running chunks on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Compression executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                batch.getQueueCapacity());

        return executor;
    }

    @Bean(name = "mirrorExecutor")
    public Executor mirrorExecutor(BatchProperties batch) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(batch.getQueueCapacity() * 10);
        executor.setThreadNamePrefix("graph-mirror-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
