package io.mindmesh.recovery;

import java.time.Clock;
import java.time.Duration;

/**
 * Consecutive-failure breaker for calls to a single agent.
 *
 * <p>CLOSED opens after {@code failureThreshold} failures in a row. OPEN lets a trial call through
 * once {@code resetTimeout} has passed, moving to HALF_OPEN. HALF_OPEN closes after
 * {@link #HALF_OPEN_SUCCESSES} successes and re-opens on any failure.
 */
public final class CircuitBreaker {
    public static final int HALF_OPEN_SUCCESSES = 3;

    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int halfOpenSuccesses;
    private long openedAtMs;

    public CircuitBreaker(int failureThreshold, Duration resetTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    public synchronized boolean allowRequest() {
        if (state == CircuitState.OPEN && clock.millis() - openedAtMs >= resetTimeout.toMillis()) {
            state = CircuitState.HALF_OPEN;
            halfOpenSuccesses = 0;
        }
        return state != CircuitState.OPEN;
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        if (state == CircuitState.HALF_OPEN && ++halfOpenSuccesses >= HALF_OPEN_SUCCESSES) {
            state = CircuitState.CLOSED;
        }
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        if (state == CircuitState.HALF_OPEN || consecutiveFailures >= failureThreshold) {
            state = CircuitState.OPEN;
            openedAtMs = clock.millis();
            halfOpenSuccesses = 0;
        }
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }
}
