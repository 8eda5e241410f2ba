package com.scoregate.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AuditConfig {

    /**
     * Executor for audit log writes. Bounded; when the queue is full the oldest
     * pending write is dropped rather than blocking a request thread.
     * {@code scoregate.audit.synchronous=true} runs writes inline (tests).
     */
    @Bean
    public Executor auditExecutor(
            @Value("${scoregate.audit.synchronous:false}") boolean synchronous,
            @Value("${scoregate.audit.pool-size:2}") int poolSize,
            @Value("${scoregate.audit.queue-capacity:1000}") int queueCapacity) {
        if (synchronous) {
            return new SyncTaskExecutor();
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("audit-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        executor.initialize();
        return executor;
    }
}
