package guraa.xmlcompare.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for thread pools and concurrency settings.
 * URL-sourced batch comparisons run on a fixed-size pool so that a large
 * batch queues work instead of opening one connection per item.
 */
@Slf4j
@Configuration
public class ConcurrencyConfig {

    private final int availableProcessors = Runtime.getRuntime().availableProcessors();

    @Value("${app.concurrency.comparison-threads:4}")
    @Getter @Setter
    private int comparisonThreads = Math.min(4, availableProcessors);

    /**
     * Executor for URL-sourced comparison tasks (fetch both documents, then compare).
     */
    @Bean(name = "comparisonExecutor", destroyMethod = "shutdown")
    public ExecutorService comparisonExecutor() {
        int threads = Math.max(1, comparisonThreads);
        log.info("Creating comparison executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, createThreadFactory("compare-", Thread.NORM_PRIORITY));
    }

    /**
     * Scheduler for the periodic session expiry sweep.
     */
    @Bean(name = "sessionSweepScheduler")
    public ThreadPoolTaskScheduler sessionSweepScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("session-sweep-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * Create a thread factory with proper naming, priority and error handling.
     *
     * @param prefix Thread name prefix
     * @param priority Thread priority
     * @return A ThreadFactory
     */
    private ThreadFactory createThreadFactory(String prefix, int priority) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(prefix + threadNumber.getAndIncrement());
                thread.setPriority(priority);
                thread.setDaemon(false);

                thread.setUncaughtExceptionHandler((t, e) -> {
                    log.error("Uncaught exception in thread {}: {}", t.getName(), e.getMessage(), e);
                });

                return thread;
            }
        };
    }
}
