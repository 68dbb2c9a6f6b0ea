package io.mindmesh.util;

import java.time.Duration;

/**
 * Exponential backoff bounded by a maximum delay and a maximum attempt count.
 */
public record Backoff(int maxAttempts, long baseDelayMs, long maxDelayMs) {
    public Backoff {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("invalid backoff bounds: base=" + baseDelayMs + " max=" + maxDelayMs);
        }
    }

    /**
     * Delay before the given retry, where {@code retry} 1 follows the first failed attempt.
     */
    public Duration delayBefore(int retry) {
        if (retry <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(retry - 1, 30);
        long delay = baseDelayMs << shift;
        if (delay < 0 || delay > maxDelayMs) {
            delay = maxDelayMs;
        }
        return Duration.ofMillis(delay);
    }

    public static void sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while backing off", e);
        }
    }
}
