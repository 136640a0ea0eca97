package net.findmycard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Card search and recommendation service.
 */
@SpringBootApplication
@EnableScheduling
public class CardRecommendationEngineApplication {

    private static final String APPLICATION_SCHEDULER_THREAD_PREFIX = "findmycard-scheduler-";
    private static final int APPLICATION_SCHEDULER_POOL_SIZE = 2;
    private static final int APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 10;

    public static void main(String[] args) {
        SpringApplication.run(CardRecommendationEngineApplication.class, args);
    }

    /**
     * Bounded scheduler for {@code @Scheduled} jobs, drained on context shutdown.
     */
    @Bean(name = "taskScheduler")
    public TaskScheduler applicationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix(APPLICATION_SCHEDULER_THREAD_PREFIX);
        scheduler.setPoolSize(APPLICATION_SCHEDULER_POOL_SIZE);
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS);
        return scheduler;
    }
}
