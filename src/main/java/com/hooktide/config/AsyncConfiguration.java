package com.hooktide.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool that runs webhook chains off the servlet threads. When the pool
 * and its queue are full, new deliveries are refused (503) instead of queued forever.
 *
 * Registry lookups run on a second pool of the same size, so a chain can stop
 * waiting on a lookup at its deadline while the socket is still being drained.
 */
@Slf4j
@Configuration
public class AsyncConfiguration {

    @Bean(name = "webhookExecutor")
    public ThreadPoolTaskExecutor webhookExecutor(HooktideProperties properties) {
        HooktideProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(settings.getCorePoolSize(), settings.getMaxPoolSize()));
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Webhook executor: core={}, max={}, queue={}",
                settings.getCorePoolSize(), settings.getMaxPoolSize(), settings.getQueueCapacity());
        return executor;
    }

    @Bean(name = "registryExecutor")
    public ThreadPoolTaskExecutor registryExecutor(HooktideProperties properties) {
        HooktideProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(settings.getCorePoolSize(), settings.getMaxPoolSize()));
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("registry-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
