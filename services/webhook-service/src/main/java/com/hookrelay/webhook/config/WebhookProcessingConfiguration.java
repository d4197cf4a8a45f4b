package com.hookrelay.webhook.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Pool for accepted webhook events. A full queue rejects the hand-off so the request thread
 * never runs the event itself.
 */
@Slf4j
@Configuration
public class WebhookProcessingConfiguration {

    public static final String WEBHOOK_PROCESSING_EXECUTOR = "webhookProcessingExecutor";

    @Bean(name = WEBHOOK_PROCESSING_EXECUTOR)
    public ThreadPoolTaskExecutor webhookProcessingExecutor(WebhookProperties properties) {
        WebhookProperties.Processing config = properties.getProcessing();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("webhook-processing-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Webhook processing executor configured: core={}, max={}, queue={}",
                config.getCorePoolSize(), config.getMaxPoolSize(), config.getQueueCapacity());
        return executor;
    }
}
