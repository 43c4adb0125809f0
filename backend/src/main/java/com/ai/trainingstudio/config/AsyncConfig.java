package com.ai.trainingstudio.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Session threading.
 *
 * All session state (workflows, uploads, location) is mutated on exactly one
 * thread. Network calls run on the WebClient event loop and hop back onto
 * this thread before touching state, so independent operations interleave
 * but never race.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "sessionExecutor")
    public ThreadPoolTaskExecutor sessionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("studio-session-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "sessionScheduler")
    public Scheduler sessionScheduler() {
        return Schedulers.fromExecutor(sessionExecutor());
    }
}
