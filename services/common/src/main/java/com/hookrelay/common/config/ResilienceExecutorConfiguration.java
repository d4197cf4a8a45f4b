package com.hookrelay.common.config;

import com.hookrelay.common.resilience.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded pool for parallel rate-limit checks and settled batches.
 * Saturation runs the task on the caller's thread instead of dropping it.
 */
@Slf4j
@Configuration
public class ResilienceExecutorConfiguration {

    public static final String RESILIENCE_TASK_EXECUTOR = "resilienceTaskExecutor";

    @Bean(name = RESILIENCE_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor resilienceTaskExecutor(HookRelayProperties properties) {
        HookRelayProperties.Resilience config = properties.getResilience();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("resilience-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        log.info("Resilience executor configured: core={}, max={}, queue={}",
                config.getCorePoolSize(), config.getMaxPoolSize(), config.getQueueCapacity());
        return executor;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}
