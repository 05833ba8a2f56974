package com.di.bigfactorial.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning for the windowed reduction.
 *
 * <pre>
 * bigfactorial:
 *   reduction:
 *     window-size: 10000
 *     window-timeout: 60s
 *     max-redispatches: 2
 *     poll-interval: 250ms
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "bigfactorial.reduction")
public class ReductionProperties {

    public static final long DEFAULT_WINDOW_SIZE = 10_000L;
    public static final int MAX_REDISPATCHES = 100;

    /** Integers per window. */
    @Min(1)
    private long windowSize = DEFAULT_WINDOW_SIZE;

    /**
     * How long one attempt at a window may run before a replacement attempt
     * is dispatched for the same window.
     */
    @NotNull
    private Duration windowTimeout = Duration.ofSeconds(60);

    /**
     * Replacement attempts allowed per window. A window that times out after
     * this many replacements fails the whole reduction.
     */
    @Min(0)
    @Max(MAX_REDISPATCHES)
    private int maxRedispatches = 2;

    /** Upper bound on a single wait for a completion message. */
    @NotNull
    private Duration pollInterval = Duration.ofMillis(250);

    /**
     * Checks the invariants {@code @Validated} cannot express and is also
     * called for instances built outside Spring.
     *
     * @throws IllegalArgumentException on the first violation found
     */
    public void validate() {
        if (windowSize < 1) {
            throw new IllegalArgumentException("bigfactorial.reduction.window-size must be >= 1, got " + windowSize);
        }
        if (windowTimeout == null || windowTimeout.isNegative() || windowTimeout.isZero()) {
            throw new IllegalArgumentException("bigfactorial.reduction.window-timeout must be positive, got " + windowTimeout);
        }
        if (maxRedispatches < 0 || maxRedispatches > MAX_REDISPATCHES) {
            throw new IllegalArgumentException(String.format(
                    "bigfactorial.reduction.max-redispatches must be between 0 and %d, got %d",
                    MAX_REDISPATCHES, maxRedispatches));
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("bigfactorial.reduction.poll-interval must be positive, got " + pollInterval);
        }
    }
}
