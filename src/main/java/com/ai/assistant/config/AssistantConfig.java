package com.ai.assistant.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

@Configuration
public class AssistantConfig {

    @Bean
    public Clock assistantClock(DialogueProperties properties) {
        return Clock.system(properties.zoneId());
    }

    /**
     * Shared client for every remote collaborator. The timeouts bound how long a single
     * call can hold a sender's exclusive section.
     */
    @Bean
    public RestTemplate collaboratorRestTemplate(
            RestTemplateBuilder builder,
            @Value("${assistant.http.connect-timeout:5s}") Duration connectTimeout,
            @Value("${assistant.http.read-timeout:20s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    @Bean(name = "inboundMessageExecutor")
    public Executor inboundMessageExecutor(
            @Value("${assistant.processing.threads:4}") int processingThreads,
            @Value("${assistant.processing.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, processingThreads);
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(50, queueCapacity));
        executor.setThreadNamePrefix("inbound-msg-");
        executor.initialize();
        return executor;
    }
}
