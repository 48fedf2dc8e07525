package com.example.reconcile.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared beans of the review engine.
 */
@Configuration
public class ReviewConfig {

    /**
     * Fixed worker pool for per-record normalization/scoring and per-group consistency checks.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService reviewExecutor(ReviewProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "review-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.pipeline().workerThreads(), factory);
    }

    /**
     * Shared ObjectMapper, built on Boot's builder so {@code spring.jackson.*} settings apply.
     */
    @Bean
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder
                .modulesToInstall(new JavaTimeModule())
                .build();
    }

    @Bean
    public Clock reviewClock() {
        return Clock.systemUTC();
    }
}
