package com.example.FundScout.service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs a blocking network call under a per-attempt timeout and a bounded retry
 * with exponential backoff. Policies are looked up by call name
 * ("embedding", "vector", "selection", "enrichment").
 */
@Component
public class ResilientCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResilientCallExecutor.class);

    private final RetryRegistry retryRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService executor;

    public ResilientCallExecutor(RetryRegistry retryRegistry,
                                 TimeLimiterRegistry timeLimiterRegistry,
                                 @Qualifier("networkCallExecutor") ExecutorService executor) {
        this.retryRegistry = retryRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.executor = executor;
    }

    /**
     * @param name      policy name, also used in logs
     * @param call      the blocking call
     * @param onFailure maps the final failure (after retries) to the caller's exception type
     */
    public <T> T call(String name, Supplier<T> call, Function<Exception, ? extends RuntimeException> onFailure) {
        Retry retry = retryRegistry.retry(name);
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(name);

        // submit() hands back a FutureTask, so a timeout interrupts the worker and frees it
        Callable<T> timed = TimeLimiter.decorateFutureSupplier(
                timeLimiter, () -> executor.submit(call::get));
        Callable<T> retrying = Retry.decorateCallable(retry, timed);
        try {
            return retrying.call();
        } catch (Exception e) {
            log.debug("Call '{}' failed after retries: {}", name, e.toString());
            throw onFailure.apply(e);
        }
    }
}
