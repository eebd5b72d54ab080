package com.community.botguard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SchedulerConfig {

    /**
     * Shared scheduler for per-approval timeout callbacks and the sweeper.
     * Pending entries are scheduled tasks, not threads.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(BotGuardConfig config) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(config.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("approval-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * Executor for {@code @Async} notification delivery, kept off the timer threads.
     */
    @Bean
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("notify-");
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
