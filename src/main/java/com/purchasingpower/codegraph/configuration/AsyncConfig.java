package com.purchasingpower.codegraph.configuration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for parsing and bounded graph queries.
 *
 * The parser pool caps how many files are parsed at once; a file the pool
 * rejects is parsed on the submitting thread. The traversal pool runs
 * traversal and resolution work so the caller can wait on it with a
 * timeout and interrupt it; when its queue is full a request is rejected
 * instead of running unbounded on the caller.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig implements AsyncConfigurer {

    private static final int TRAVERSAL_QUEUE_CAPACITY = 500;

    private final AppProperties appProperties;

    @Bean(name = "parserExecutor")
    @Override
    public ThreadPoolTaskExecutor getAsyncExecutor() {
        int concurrency = appProperties.getIngestion().getParserConcurrency();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // Fixed size: the queue absorbs the rest of the file set
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setThreadNamePrefix("parser-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("✅ Parser executor configured: concurrency={}", concurrency);
        return executor;
    }

    @Bean(name = "traversalExecutor")
    public ThreadPoolTaskExecutor traversalExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(TRAVERSAL_QUEUE_CAPACITY);
        executor.setThreadNamePrefix("graph-query-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("✅ Traversal executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                TRAVERSAL_QUEUE_CAPACITY);
        return executor;
    }
}
