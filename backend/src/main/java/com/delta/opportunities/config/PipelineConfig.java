package com.delta.opportunities.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    @Bean(name = "orchestratorExecutor", destroyMethod = "shutdown")
    public ExecutorService orchestratorExecutor(PipelineProperties properties) {
        return Executors.newFixedThreadPool(
            properties.getOrchestrator().getWorkerPoolSize(),
            namedThreads("orchestrator-worker")
        );
    }

    @Bean(name = "generatorExecutor", destroyMethod = "shutdown")
    public ExecutorService generatorExecutor(PipelineProperties properties) {
        int size = Math.max(2, properties.getOrchestrator().getWorkerPoolSize());
        return Executors.newFixedThreadPool(size, namedThreads("generator-call"));
    }

    @Bean(name = "pipelineScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService pipelineScheduler() {
        return Executors.newScheduledThreadPool(2, namedThreads("pipeline-scheduler"));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(PipelineProperties properties) {
        int size = Math.max(4, properties.getOrchestrator().getWorkerPoolSize());
        return Executors.newFixedThreadPool(size, namedThreads("http-client"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
