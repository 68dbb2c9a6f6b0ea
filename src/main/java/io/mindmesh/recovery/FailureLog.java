package io.mindmesh.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Bounded log of agent failures, newest last. Totals keep counting after old records are
 * evicted.
 */
public final class FailureLog {
    private static final Logger logger = LoggerFactory.getLogger(FailureLog.class);
    public static final int DEFAULT_CAPACITY = 1_000;

    private final int capacity;
    private final Clock clock;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private long totalFailures;
    private long recoveredFailures;

    public FailureLog(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public synchronized FailureRecord record(String agentId, String errorType, String message, String taskId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        Entry entry = new Entry(UUID.randomUUID().toString(), agentId, errorType, message, taskId, clock.millis());
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
        totalFailures++;
        logger.debug("failure {} recorded for agent {}: {} {}", entry.id, agentId, errorType, message);
        return entry.view();
    }

    /**
     * Marks every retained, not yet recovered failure of the agent as recovered. Returns how many
     * were marked.
     */
    public synchronized int markRecovered(String agentId) {
        long now = clock.millis();
        int marked = 0;
        for (Entry entry : entries) {
            if (!entry.recovered && entry.agentId.equals(agentId)) {
                entry.recovered = true;
                entry.recoveredAtMs = now;
                marked++;
            }
        }
        recoveredFailures += marked;
        return marked;
    }

    /**
     * Newest first. A null {@code agentId} lists every agent.
     */
    public synchronized List<FailureRecord> recent(String agentId, int limit) {
        List<FailureRecord> out = new ArrayList<>();
        Iterator<Entry> it = entries.descendingIterator();
        while (it.hasNext() && out.size() < limit) {
            Entry entry = it.next();
            if (agentId == null || entry.agentId.equals(agentId)) {
                out.add(entry.view());
            }
        }
        return out;
    }

    public synchronized long totalFailures() {
        return totalFailures;
    }

    public synchronized long recoveredFailures() {
        return recoveredFailures;
    }

    public synchronized HealthSummary health(Map<String, CircuitState> circuits) {
        return HealthSummary.of(circuits, totalFailures, recoveredFailures);
    }

    private static final class Entry {
        final String id;
        final String agentId;
        final String errorType;
        final String message;
        final String taskId;
        final long atMs;
        boolean recovered;
        Long recoveredAtMs;

        Entry(String id, String agentId, String errorType, String message, String taskId, long atMs) {
            this.id = id;
            this.agentId = agentId;
            this.errorType = errorType;
            this.message = message;
            this.taskId = taskId;
            this.atMs = atMs;
        }

        FailureRecord view() {
            return new FailureRecord(id, agentId, errorType, message, taskId, atMs, recovered, recoveredAtMs);
        }
    }
}
