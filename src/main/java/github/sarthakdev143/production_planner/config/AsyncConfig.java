package github.sarthakdev143.production_planner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for asset analysis and for streaming progress events to clients, plus the
 * scheduler that enforces analysis deadlines and runs retention sweeps.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "analysisTaskExecutor")
    public TaskExecutor analysisTaskExecutor(PlannerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.analysis().poolSize());
        executor.setMaxPoolSize(properties.analysis().poolSize());
        executor.setQueueCapacity(properties.analysis().queueCapacity());
        executor.setThreadNamePrefix("asset-analysis-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "progressStreamExecutor")
    public TaskExecutor progressStreamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("progress-stream-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "plannerTaskScheduler")
    public TaskScheduler plannerTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setThreadNamePrefix("planner-scheduler-");
        scheduler.initialize();
        return scheduler;
    }
}
