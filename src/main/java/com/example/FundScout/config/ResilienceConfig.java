package com.example.FundScout.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Timeout + bounded retry for every outbound call (embedding, vector query, chat).
 * All named instances share the defaults from {@code funding.resilience.*}.
 */
@Configuration
@EnableConfigurationProperties(FundingProperties.class)
public class ResilienceConfig {

    @Bean
    public RetryRegistry retryRegistry(FundingProperties properties) {
        FundingProperties.Resilience r = properties.getResilience();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, r.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(r.getBackoff(), 2.0))
                // rejected requests and bad keys fail the same way on every attempt
                .ignoreExceptions(NonTransientAiException.class, IllegalArgumentException.class)
                .build();
        return RetryRegistry.of(config);
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(FundingProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(properties.getResilience().getTimeout())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiterRegistry.of(config);
    }

    /**
     * Socket timeouts on the RestClient behind the Spring AI models, so an abandoned
     * attempt also drops its connection.
     */
    @Bean
    public RestClientCustomizer modelHttpTimeouts(FundingProperties properties) {
        FundingProperties.Resilience r = properties.getResilience();
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(r.getConnectTimeout());
            factory.setReadTimeout(r.getTimeout());
            builder.requestFactory(factory);
        };
    }

    /** Threads that run the time-limited network calls. */
    @Bean(destroyMethod = "shutdown")
    @Qualifier("networkCallExecutor")
    public ExecutorService networkCallExecutor() {
        return Executors.newFixedThreadPool(16);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
