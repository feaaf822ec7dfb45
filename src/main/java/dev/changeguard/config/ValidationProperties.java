package dev.changeguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Pipeline switches and time budgets. The collection deadline bounds a whole fact-gathering
 * pass, so it has to leave room for at least one full fetch.
 */
@ConfigurationProperties(prefix = "changeguard.validation")
public record ValidationProperties(
        Boolean enabled,
        Boolean asyncEnabled,
        Duration fetchTimeout,
        Duration collectionDeadline,
        Duration postTimeout,
        String cloneTargetInstance,
        String cloneSourceInstance,
        Duration cloneMaxAge
) {
    public ValidationProperties {
        if (enabled == null) enabled = true;
        if (asyncEnabled == null) asyncEnabled = true;
        if (fetchTimeout == null) fetchTimeout = Duration.ofSeconds(8);
        if (collectionDeadline == null) collectionDeadline = Duration.ofSeconds(20);
        if (postTimeout == null) postTimeout = Duration.ofSeconds(10);
        if (cloneMaxAge == null) cloneMaxAge = Duration.ofDays(30);
        if (collectionDeadline.compareTo(fetchTimeout) <= 0)
            throw new IllegalArgumentException("collection-deadline (%s) must exceed fetch-timeout (%s)"
                    .formatted(collectionDeadline, fetchTimeout));
    }

    public static ValidationProperties defaults() {
        return new ValidationProperties(null, null, null, null, null, null, null, null);
    }

    public boolean cloneCheckConfigured() {
        return cloneTargetInstance != null && !cloneTargetInstance.isBlank()
                && cloneSourceInstance != null && !cloneSourceInstance.isBlank();
    }
}
