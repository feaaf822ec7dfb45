package dev.changeguard.domain.valueobject;

import dev.changeguard.domain.enums.CloneFreshnessStatus;

/**
 * Freshness of the test environment clone. {@code fresh} is null whenever the
 * answer is unknown (skipped, missing record, unreadable age).
 */
public record EnvironmentHealth(
        CloneFreshnessStatus status,
        String targetInstance,
        String sourceInstance,
        String lastCloneDate,
        Long ageDays,
        Boolean fresh,
        String message
) {
    public static EnvironmentHealth skipped(String target, String source, String message) {
        return new EnvironmentHealth(CloneFreshnessStatus.SKIPPED, target, source, null, null, null, message);
    }

    public static EnvironmentHealth unavailable(CloneFreshnessStatus status, String target,
                                                String source, String message) {
        return new EnvironmentHealth(status, target, source, null, null, null, message);
    }

    public boolean applies() {
        return status != CloneFreshnessStatus.SKIPPED;
    }
}
