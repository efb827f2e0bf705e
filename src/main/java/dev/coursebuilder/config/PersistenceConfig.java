package dev.coursebuilder.config;

import dev.coursebuilder.infrastructure.persistence.WorkRecordWriter;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for work record writes.
 *
 * <p>Each attempt of a read-modify-write runs in its own transaction, so the retry
 * wraps the transaction, never the other way round. A version
 * mismatch, a lock failure or a duplicate first insert all mean "someone else
 * wrote this record first" and are retried. Any other integrity violation is a
 * bad value and fails on the first attempt.
 *
 * <p>Waits grow exponentially from {@code write-backoff} with random jitter so
 * writers that lost the same round do not collide again on the next one.
 */
@Configuration
public class PersistenceConfig {

    public static final String WORK_RECORD_RETRY = "work-record";

    private static final double BACKOFF_MULTIPLIER = 1.5;
    private static final double BACKOFF_JITTER = 0.5;

    @Bean
    public Retry workRecordRetry(RetryRegistry retryRegistry, ReviewProperties properties) {
        return retryRegistry.retry(WORK_RECORD_RETRY, workRecordRetryConfig(properties));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    public static RetryConfig workRecordRetryConfig(ReviewProperties properties) {
        return RetryConfig.custom()
                .maxAttempts(properties.writeAttempts())
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        properties.writeBackoff(), BACKOFF_MULTIPLIER, BACKOFF_JITTER))
                .retryOnException(WorkRecordWriter::isWriteConflict)
                .build();
    }
}
