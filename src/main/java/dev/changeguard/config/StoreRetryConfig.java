package dev.changeguard.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.function.Predicate;

/**
 * Retry policies for the validation store. Only connectivity and contention failures are
 * retried; constraint violations and mapping errors fail on the first attempt.
 */
@Configuration
public class StoreRetryConfig {

    public static final String WRITE_RETRY = "validation-store-write";
    public static final String READ_RETRY = "validation-store-read";

    @Bean
    public Retry storeWriteRetry(RetryRegistry registry, StoreProperties properties) {
        return registry.retry(WRITE_RETRY, retryConfig(properties.writeRetry()));
    }

    @Bean
    public Retry storeReadRetry(RetryRegistry registry, StoreProperties properties) {
        return registry.retry(READ_RETRY, retryConfig(properties.readRetry()));
    }

    public static RetryConfig retryConfig(StoreProperties.RetrySettings settings) {
        return RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.initialInterval(), settings.multiplier(), settings.maxInterval()))
                .retryOnException(isTransient())
                .build();
    }

    static Predicate<Throwable> isTransient() {
        return t -> t instanceof TransientDataAccessException
                || t instanceof RecoverableDataAccessException
                || t instanceof DataAccessResourceFailureException
                || t instanceof CannotCreateTransactionException
                || t instanceof QueryTimeoutException;
    }
}
