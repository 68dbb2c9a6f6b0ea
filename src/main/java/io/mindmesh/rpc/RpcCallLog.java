package io.mindmesh.rpc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded history of dispatched calls with running per-method totals.
 */
public final class RpcCallLog {
    public static final int DEFAULT_CAPACITY = 1_024;

    private final int capacity;
    private final Deque<RpcCallRecord> recent;
    private final Map<String, MethodCounters> byMethod;
    private long totalCalls;
    private long failedCalls;
    private long totalDurationMicros;

    public RpcCallLog(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.recent = new ArrayDeque<>();
        this.byMethod = new LinkedHashMap<>();
    }

    public synchronized void record(RpcCallRecord call) {
        recent.addLast(call);
        while (recent.size() > capacity) {
            recent.removeFirst();
        }
        totalCalls++;
        totalDurationMicros += call.durationMicros();
        if (!call.success()) {
            failedCalls++;
        }
        MethodCounters counters = byMethod.computeIfAbsent(call.method(), k -> new MethodCounters());
        counters.count++;
        counters.durationMicros += call.durationMicros();
        if (!call.success()) {
            counters.failed++;
        }
    }

    public synchronized List<RpcCallRecord> recent(int limit) {
        List<RpcCallRecord> out = new ArrayList<>(Math.min(Math.max(0, limit), recent.size()));
        var it = recent.descendingIterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }

    public synchronized RpcCallStats stats() {
        Map<String, RpcCallStats.MethodStats> methods = new LinkedHashMap<>();
        for (Map.Entry<String, MethodCounters> e : byMethod.entrySet()) {
            MethodCounters c = e.getValue();
            methods.put(e.getKey(), new RpcCallStats.MethodStats(
                    c.count,
                    c.count - c.failed,
                    c.failed,
                    c.count == 0 ? 0.0 : c.durationMicros / (double) c.count / 1_000.0
            ));
        }
        return new RpcCallStats(
                totalCalls,
                totalCalls - failedCalls,
                failedCalls,
                totalCalls == 0 ? 0.0 : totalDurationMicros / (double) totalCalls / 1_000.0,
                methods
        );
    }

    private static final class MethodCounters {
        private long count;
        private long failed;
        private long durationMicros;
    }
}
