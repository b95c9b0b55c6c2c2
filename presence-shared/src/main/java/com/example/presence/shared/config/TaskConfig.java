package com.example.presence.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    // Only the live record sweep runs on it
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("presence-sweep-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * One long-lived worker per running commentary engine. Engines block on their own queue and
     * on the text generation call, so they must never run on the Netty event loop.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler commentaryScheduler(AppProperties appProperties) {
        return Schedulers.newBoundedElastic(appProperties.getCommentary().getMaxEngines(), 16, "commentary-");
    }

    /**
     * Session actions and the external collaborator calls they make (identity, participation,
     * persistence, push) may block.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler sessionScheduler() {
        return Schedulers.newBoundedElastic(50, 10000, "session-");
    }
}
