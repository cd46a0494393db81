package com.shoryokuka.infrastructure.generation.loop;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class GenerationConfig {

    @Bean(name = "sectionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService sectionExecutor(GenerationProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getParallelism()), workerThreads());
    }

    static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "section-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
