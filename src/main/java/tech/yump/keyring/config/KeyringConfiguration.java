package tech.yump.keyring.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@Slf4j
public class KeyringConfiguration {

    public static final String ROTATION_TASK_SCHEDULER = "keyRotationTaskScheduler";

    /**
     * Wall-clock source for key timestamps and token claims. Tests replace it with a controllable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Single thread: at most one scheduled rotation check runs at a time.
    @Bean(name = ROTATION_TASK_SCHEDULER)
    public ThreadPoolTaskScheduler keyRotationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("key-rotation-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        log.debug("Created single-threaded task scheduler for key rotation.");
        return scheduler;
    }
}
