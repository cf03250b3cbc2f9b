package uk.gegc.formbatch.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for batch processing.
 *
 * - batchTaskExecutor drives one job at a time per thread (validation, reservation, dispatch, packaging)
 * - rowTaskExecutor runs individual rows; a job never has more rows in flight than its parallelism limit
 * - formFillExecutor isolates the form-fill call so the row timeout can be enforced
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.batch.core-pool-size:2}")
    private int batchCorePoolSize;

    @Value("${async.batch.max-pool-size:4}")
    private int batchMaxPoolSize;

    @Value("${async.batch.queue-capacity:100}")
    private int batchQueueCapacity;

    @Value("${async.row.core-pool-size:4}")
    private int rowCorePoolSize;

    @Value("${async.row.max-pool-size:8}")
    private int rowMaxPoolSize;

    @Value("${async.row.queue-capacity:200}")
    private int rowQueueCapacity;

    @Value("${async.form-fill.core-pool-size:4}")
    private int formFillCorePoolSize;

    @Value("${async.form-fill.max-pool-size:8}")
    private int formFillMaxPoolSize;

    @Value("${async.form-fill.queue-capacity:200}")
    private int formFillQueueCapacity;

    @Value("${async.keep-alive-seconds:60}")
    private int keepAliveSeconds;

    @Bean(name = "batchTaskExecutor")
    public Executor batchTaskExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor("batch-", batchCorePoolSize, batchMaxPoolSize, batchQueueCapacity);
        // Jobs wait in the queue instead of running on the publishing thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();

        log.info("Batch Task Executor configured - Core: {}, Max: {}, Queue: {}",
                batchCorePoolSize, batchMaxPoolSize, batchQueueCapacity);
        return executor;
    }

    @Bean(name = "rowTaskExecutor")
    public Executor rowTaskExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor("row-", rowCorePoolSize, rowMaxPoolSize, rowQueueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();

        log.info("Row Task Executor configured - Core: {}, Max: {}, Queue: {}",
                rowCorePoolSize, rowMaxPoolSize, rowQueueCapacity);
        return executor;
    }

    @Bean(name = "formFillExecutor")
    public Executor formFillExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor("form-fill-", formFillCorePoolSize, formFillMaxPoolSize, formFillQueueCapacity);
        // A fill running on the caller could not be abandoned at the row timeout; rejected rows fail instead
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();

        log.info("Form Fill Executor configured - Core: {}, Max: {}, Queue: {}",
                formFillCorePoolSize, formFillMaxPoolSize, formFillQueueCapacity);
        return executor;
    }

    private ThreadPoolTaskExecutor newExecutor(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setKeepAliveSeconds(keepAliveSeconds);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return batchTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, java.lang.reflect.Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(),
                        java.util.Arrays.toString(params), ex);

                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
