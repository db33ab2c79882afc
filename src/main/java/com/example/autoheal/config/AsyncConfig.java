package com.example.autoheal.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Named pools behind {@code @Async}. Remediation runs are bounded by the
 * hourly action budget, so that pool stays small. The remediation and
 * diagnosis pools reject on overflow; their callers must never run the work
 * themselves.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "remediationExecutor")
    public Executor remediationExecutor(AutohealProperties properties) {
        int max = Math.max(2, Math.min(8, properties.getRemediation().getMaxActionsPerHour()));
        return pool("remediate-", 2, max, 100, new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "diagnosisExecutor")
    public Executor diagnosisExecutor() {
        return pool("diagnose-", 2, 4, 50, new ThreadPoolExecutor.AbortPolicy());
    }

    /** Audit writes and notifications; a full queue runs the task on the caller */
    @Bean(name = "backgroundExecutor")
    public Executor backgroundExecutor() {
        return pool("background-", 2, 6, 200, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    static ThreadPoolTaskExecutor pool(String prefix, int core, int max, int queue,
                                        RejectedExecutionHandler onOverflow) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(onOverflow);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
