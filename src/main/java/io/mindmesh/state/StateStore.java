package io.mindmesh.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.mindmesh.error.StateNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Last-writer-wins key/value map shared across the mesh.
 *
 * <p>Entries are ordered by {@code (version, originAgentId)}, so every node that has seen the
 * same set of writes holds the same value for each key, whatever order they arrived in. Local
 * writes take a version above every version this node has seen.
 */
public final class StateStore {
    private static final Logger logger = LoggerFactory.getLogger(StateStore.class);

    private final String nodeId;
    private final Clock clock;
    private final Map<String, StateEntry> entries = new TreeMap<>();
    private final List<StateWriteListener> listeners = new CopyOnWriteArrayList<>();
    private long highestVersion;

    public StateStore(String nodeId, Clock clock) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("node id cannot be empty");
        }
        this.nodeId = nodeId;
        this.clock = clock;
    }

    public StateStore(String nodeId) {
        this(nodeId, Clock.systemUTC());
    }

    public String nodeId() {
        return nodeId;
    }

    public void addWriteListener(StateWriteListener listener) {
        listeners.add(listener);
    }

    public StateEntry set(String key, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new IllegalArgumentException("state value cannot be null, use delete: " + key);
        }
        return write(key, value);
    }

    /**
     * Writes a tombstone for a live key.
     *
     * @return the tombstone, or empty when the key was absent or already deleted
     */
    public Optional<StateEntry> delete(String key) {
        synchronized (this) {
            StateEntry current = entries.get(key);
            if (current == null || current.isTombstone()) {
                return Optional.empty();
            }
        }
        return Optional.of(write(key, NullNode.getInstance()));
    }

    public synchronized Optional<StateEntry> get(String key) {
        StateEntry entry = entries.get(key);
        if (entry == null || entry.isTombstone()) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public StateEntry require(String key) {
        return get(key).orElseThrow(() -> StateNotFoundException.forKey(key));
    }

    /**
     * Applies an entry written elsewhere. Entries not ordered after the local one are dropped.
     */
    public synchronized boolean apply(StateEntry incoming) {
        StateEntry current = entries.get(incoming.key());
        highestVersion = Math.max(highestVersion, incoming.version());
        if (!incoming.supersedes(current)) {
            return false;
        }
        entries.put(incoming.key(), incoming);
        return true;
    }

    public synchronized int mergeAll(Collection<StateEntry> incoming) {
        int accepted = 0;
        for (StateEntry entry : incoming) {
            if (apply(entry)) {
                accepted++;
            }
        }
        if (accepted > 0) {
            logger.debug("merged {} of {} state entries", accepted, incoming.size());
        }
        return accepted;
    }

    /**
     * Every entry including tombstones, ordered by key.
     */
    public synchronized List<StateEntry> snapshot() {
        return new ArrayList<>(entries.values());
    }

    /**
     * Drops tombstones older than {@code retention}. Returns how many were removed.
     */
    public synchronized int compact(Duration retention) {
        long cutoff = clock.millis() - retention.toMillis();
        int removed = 0;
        Iterator<StateEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            StateEntry entry = it.next();
            if (entry.isTombstone() && entry.writtenAtMs() <= cutoff) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("compacted {} tombstone(s)", removed);
        }
        return removed;
    }

    public synchronized int liveKeys() {
        int live = 0;
        for (StateEntry entry : entries.values()) {
            if (!entry.isTombstone()) {
                live++;
            }
        }
        return live;
    }

    public synchronized long highestVersion() {
        return highestVersion;
    }

    private StateEntry write(String key, JsonNode value) {
        StateEntry entry;
        synchronized (this) {
            StateEntry current = entries.get(key);
            long floor = current == null ? highestVersion : Math.max(highestVersion, current.version());
            entry = new StateEntry(key, value, floor + 1, nodeId, clock.millis());
            entries.put(key, entry);
            highestVersion = entry.version();
        }
        for (StateWriteListener listener : listeners) {
            try {
                listener.onLocalWrite(entry);
            } catch (RuntimeException e) {
                logger.warn("state write listener failed for key {}", key, e);
            }
        }
        return entry;
    }
}
