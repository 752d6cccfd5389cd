package org.mides.delivery.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SpringConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService executorService(OptimizerConfiguration optimizerConfig) {
        return Executors.newFixedThreadPool(optimizerConfig.getExecutorThreads());
    }

    /* Source of the default hour/day when a request leaves them out */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
