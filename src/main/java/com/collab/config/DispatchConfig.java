package com.collab.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DispatchConfig {

    @Bean(name = "collabDispatchExecutor")
    public ThreadPoolTaskExecutor collabDispatchExecutor(CollaborationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDispatchThreads());
        executor.setMaxPoolSize(properties.getDispatchThreads());
        executor.setThreadNamePrefix("collab-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }
}
