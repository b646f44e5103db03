package com.newsdigest.backend.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Task executor for per-source feed and listing fetches
     */
    @Bean
    public Executor ingestionTaskExecutor(ScrapingConfig scrapingConfig) {
        int poolSize = Math.max(1, scrapingConfig.getMaxConcurrentSources());
        return boundedExecutor(poolSize, 200, "Ingest-");
    }

    /**
     * Task executor for article page fetches behind HTML listings
     */
    @Bean
    public Executor articleFetchExecutor(ScrapingConfig scrapingConfig) {
        int poolSize = Math.max(1, scrapingConfig.getMaxConcurrentArticleFetches());
        return boundedExecutor(poolSize, 100, "Article-");
    }

    private static ThreadPoolTaskExecutor boundedExecutor(int poolSize, int queueCapacity, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
