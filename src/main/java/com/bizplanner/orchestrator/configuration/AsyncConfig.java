package com.bizplanner.orchestrator.configuration;

import com.bizplanner.orchestrator.config.OrchestratorConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for orchestration.
 *
 * <ul>
 *   <li>{@code agentTaskExecutor} runs agent tasks of a parallel plan</li>
 *   <li>{@code callExecutor} runs individual completion and skill calls so the
 *       caller can stop waiting when a deadline passes</li>
 * </ul>
 *
 * The two pools are separate: a full agent pool never starves the calls its
 * own tasks are waiting on.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "agentTaskExecutor")
    public ThreadPoolTaskExecutor agentTaskExecutor(OrchestratorConfig config) {
        OrchestratorConfig.PoolConfig pool = config.getPool();
        return build("agent-task-", pool.getCoreSize(), pool.getMaxSize(), pool.getQueueCapacity());
    }

    @Bean(name = "callExecutor")
    public ThreadPoolTaskExecutor callExecutor(OrchestratorConfig config) {
        OrchestratorConfig.PoolConfig pool = config.getPool();
        return build("llm-call-", pool.getCoreSize() * 2, pool.getMaxSize() * 2, pool.getQueueCapacity());
    }

    private ThreadPoolTaskExecutor build(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // Core pool size - number of threads to keep alive
        executor.setCorePoolSize(core);

        // Max pool size - maximum number of threads
        executor.setMaxPoolSize(max);

        // Queue capacity - number of tasks to queue before rejecting
        executor.setQueueCapacity(queue);

        // Thread name prefix for debugging
        executor.setThreadNamePrefix(prefix);

        // Wait for tasks to complete on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("✅ Executor {} configured: core={}, max={}, queue={}",
                prefix, executor.getCorePoolSize(), executor.getMaxPoolSize(), queue);

        return executor;
    }
}
