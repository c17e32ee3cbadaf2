package com.automate.FindingSync.Config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {
    @Bean(name = "syncExecutor")
    public Executor syncExecutor(SyncProperties syncProperties) {
        SyncProperties.Executor cfg = syncProperties.getExecutor();
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(cfg.getCorePoolSize());
        ex.setMaxPoolSize(Math.max(cfg.getCorePoolSize(), cfg.getMaxPoolSize()));
        ex.setQueueCapacity(cfg.getQueueCapacity());
        ex.setThreadNamePrefix("finding-sync-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.setAwaitTerminationSeconds(30);
        ex.initialize();
        return ex;
    }
}
