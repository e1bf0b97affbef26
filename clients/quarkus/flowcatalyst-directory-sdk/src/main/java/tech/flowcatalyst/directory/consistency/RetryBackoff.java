package tech.flowcatalyst.directory.consistency;

import tech.flowcatalyst.directory.config.DirectoryClientConfig;

import java.time.Duration;

/**
 * Bounds and delays for the consistency retry loop: exponential, capped, with an overall budget.
 *
 * @param maxAttempts total attempts, including the first
 * @param initialDelayMs delay before the second attempt
 * @param maxDelayMs cap for any single delay
 * @param timeout overall budget for one call
 */
public record RetryBackoff(int maxAttempts, long initialDelayMs, long maxDelayMs, Duration timeout) {

    public RetryBackoff {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelayMs < 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("delays must satisfy 0 <= initialDelay <= maxDelay");
        }
    }

    public static RetryBackoff from(DirectoryClientConfig.ConsistencyConfig config) {
        return new RetryBackoff(
            config.maxAttempts(),
            config.initialDelay(),
            config.maxDelay(),
            Duration.ofSeconds(config.timeout())
        );
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public long delayFor(int attempt) {
        long delay = initialDelayMs;
        for (int i = 1; i < attempt && delay < maxDelayMs; i++) {
            delay = delay * 2;
        }
        return Math.min(delay, maxDelayMs);
    }
}
