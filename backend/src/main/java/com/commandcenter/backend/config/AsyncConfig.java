package com.commandcenter.backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;

/**
 * Background work: agent trigger calls and the periodic archive sweep.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    public static final String TRIGGER_EXECUTOR = "agentTriggerExecutor";

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Bean(TRIGGER_EXECUTOR)
    public Executor agentTriggerExecutor() {
        return triggerExecutor(1, 4, 100);
    }

    /** A full backlog drops the call with a warning; the caller never sees the rejection. */
    static ThreadPoolTaskExecutor triggerExecutor(int corePoolSize, int maxPoolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("agent-trigger-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setRejectedExecutionHandler(dropWithWarning());
        executor.initialize();
        return executor;
    }

    static RejectedExecutionHandler dropWithWarning() {
        return (task, pool) -> log.warn("Agent trigger backlog full ({} queued), dropping trigger call",
                pool.getQueue().size());
    }

    /**
     * Picked by name for {@code @Scheduled} methods; the WebSocket support registers a
     * scheduler of its own that is not meant for application tasks.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("archive-sweep-");
        return scheduler;
    }
}
