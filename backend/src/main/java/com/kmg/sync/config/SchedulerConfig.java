package com.kmg.sync.config;

import com.kmg.sync.schedule.CronTriggerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.ZoneId;

@Configuration
public class SchedulerConfig {
    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public ThreadPoolTaskScheduler cronTaskScheduler(SyncProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("sync-cron-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor syncWorkerExecutor(SyncProperties properties) {
        int workers = properties.getScheduler().getWorkerPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("sync-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean(destroyMethod = "shutdown")
    public CronTriggerRegistry cronTriggerRegistry(
            @Qualifier("cronTaskScheduler") ThreadPoolTaskScheduler cronTaskScheduler,
            SyncProperties properties
    ) {
        ZoneId zoneId = ZoneId.of(properties.getScheduler().getTimezone());
        log.info("Cron triggers evaluated in time zone {}", zoneId);
        return new CronTriggerRegistry(cronTaskScheduler, zoneId);
    }
}
