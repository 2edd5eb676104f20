package com.deepansh.inbox.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for agent runs and for trace persistence.
 *
 * Runs: one task per accepted trigger event. The bounded queue is the
 * backpressure signal; a full queue rejects and the subscriber requeues.
 * Traces: best-effort writes, isolated so a slow store never holds a run worker.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "agentRunExecutor")
    public ThreadPoolTaskExecutor agentRunExecutor(AgentProperties properties) {
        AgentProperties.Workers workers = properties.getWorkers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers.getCorePoolSize());
        executor.setMaxPoolSize(workers.getMaxPoolSize());
        executor.setQueueCapacity(workers.getQueueCapacity());
        executor.setThreadNamePrefix("agent-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(workers.getShutdownGraceSeconds());
        executor.initialize();
        return executor;
    }

    @Bean(name = "traceTaskExecutor")
    public ThreadPoolTaskExecutor traceTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("trace-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
