package dev.changeguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry budgets for the validation store. Writes get fewer attempts than reads:
 * a write that keeps failing is better surfaced to the queue than held in-process.
 */
@ConfigurationProperties(prefix = "changeguard.store")
public record StoreProperties(RetrySettings writeRetry, RetrySettings readRetry) {

    public StoreProperties {
        if (writeRetry == null) writeRetry = new RetrySettings(3, Duration.ofMillis(200), Duration.ofSeconds(3), 2.0);
        if (readRetry == null) readRetry = new RetrySettings(5, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0);
    }

    public record RetrySettings(int maxAttempts, Duration initialInterval, Duration maxInterval, double multiplier) {
        public RetrySettings {
            if (maxAttempts <= 0) maxAttempts = 1;
            if (initialInterval == null) initialInterval = Duration.ofMillis(100);
            if (maxInterval == null) maxInterval = Duration.ofSeconds(5);
            if (multiplier < 1.0) multiplier = 2.0;
        }
    }
}
