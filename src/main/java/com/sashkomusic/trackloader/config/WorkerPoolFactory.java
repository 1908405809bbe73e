package com.sashkomusic.trackloader.config;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Creates the fixed-size worker pool for one run. The run shuts the pool down when it ends.
 */
@Component
public class WorkerPoolFactory {

    public static final String THREAD_NAME_PREFIX = "track-worker-";

    public ThreadPoolTaskExecutor create(int workerCount) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerCount);
        executor.setMaxPoolSize(workerCount);
        executor.setThreadNamePrefix(THREAD_NAME_PREFIX);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
