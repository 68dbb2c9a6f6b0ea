package io.mindmesh.recovery;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One breaker per agent id, created on first use.
 */
public final class CircuitBreakers {
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakers(int failureThreshold, Duration resetTimeout, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    public CircuitBreaker forAgent(String agentId) {
        return breakers.computeIfAbsent(agentId, ignored -> new CircuitBreaker(failureThreshold, resetTimeout, clock));
    }

    public boolean allows(String agentId) {
        return forAgent(agentId).allowRequest();
    }

    public void forget(String agentId) {
        breakers.remove(agentId);
    }

    public Map<String, CircuitState> states() {
        Map<String, CircuitState> out = new TreeMap<>();
        breakers.forEach((id, breaker) -> out.put(id, breaker.state()));
        return out;
    }
}
