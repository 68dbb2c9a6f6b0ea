package io.mindmesh.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Membership table of the mesh, in registration order.
 *
 * <p>Readers share a read lock, so listing never waits on other listers. Status moves only
 * ACTIVE to SUSPECT to DEAD, or SUSPECT back to ACTIVE on a heartbeat. A DEAD record never turns
 * ACTIVE; registering the same id again replaces it with a new record.
 */
public final class AgentRegistry {
    private static final Logger logger = LoggerFactory.getLogger(AgentRegistry.class);

    private final Clock clock;
    private final Map<String, AgentRecord> agents = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<MembershipListener> listeners = new CopyOnWriteArrayList<>();

    public AgentRegistry(Clock clock) {
        this.clock = clock;
    }

    public AgentRegistry() {
        this(Clock.systemUTC());
    }

    public void addListener(MembershipListener listener) {
        listeners.add(listener);
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Adds an agent or replaces its address and capabilities. A re-registration keeps the
     * original position and registration time and makes the agent ACTIVE again. A DEAD agent
     * that registers again is dropped and added as a new agent at the end.
     */
    public AgentRecord register(String id, String host, int port, List<String> capabilities) {
        Instant now = clock.instant();
        AgentRecord before;
        AgentRecord after;
        lock.writeLock().lock();
        try {
            before = agents.get(id);
            if (before != null && before.status() == AgentStatus.DEAD) {
                after = AgentRecord.active(id, host, port, capabilities, now);
                agents.remove(id);
            } else {
                after = before == null
                        ? AgentRecord.active(id, host, port, capabilities, now)
                        : new AgentRecord(id, host, port, capabilities, AgentStatus.ACTIVE, now, before.registeredAt(),
                        before.status() == AgentStatus.ACTIVE ? before.statusChangedAt() : now);
            }
            agents.put(id, after);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("agent {} registered at {}:{} capabilities={}", id, host, port, after.capabilities());
        if (before != null && before.status() == AgentStatus.DEAD) {
            notifyListeners(before, null);
            notifyListeners(null, after);
        } else {
            notifyListeners(before, after);
        }
        return after;
    }

    public boolean deregister(String id) {
        AgentRecord removed;
        lock.writeLock().lock();
        try {
            removed = agents.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            logger.info("agent {} deregistered", id);
            notifyListeners(removed, null);
        }
        return removed != null;
    }

    public Optional<AgentRecord> get(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(agents.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All records in registration order, or with a capability filter only the ACTIVE agents that
     * own it.
     */
    public List<AgentRecord> list(String capability) {
        lock.readLock().lock();
        try {
            List<AgentRecord> out = new ArrayList<>(agents.size());
            for (AgentRecord record : agents.values()) {
                if (capability == null || capability.isBlank()
                        || (record.status() == AgentStatus.ACTIVE && record.hasCapability(capability))) {
                    out.add(record);
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AgentRecord> list() {
        return list(null);
    }

    public HeartbeatOutcome heartbeat(String id) {
        Instant now = clock.instant();
        AgentRecord before;
        AgentRecord after;
        lock.writeLock().lock();
        try {
            before = agents.get(id);
            if (before == null) {
                return HeartbeatOutcome.UNKNOWN;
            }
            if (before.status() == AgentStatus.DEAD) {
                return HeartbeatOutcome.REJECTED_DEAD;
            }
            after = before.withHeartbeat(now);
            agents.put(id, after);
        } finally {
            lock.writeLock().unlock();
        }
        if (before.status() == AgentStatus.SUSPECT) {
            logger.info("agent {} recovered from SUSPECT", id);
            notifyListeners(before, after);
            return HeartbeatOutcome.RECOVERED;
        }
        return HeartbeatOutcome.ACCEPTED;
    }

    /**
     * ACTIVE to SUSPECT. Returns false when the agent is missing or not ACTIVE.
     */
    public boolean markSuspect(String id) {
        return transition(id, AgentStatus.ACTIVE, AgentStatus.SUSPECT);
    }

    /**
     * SUSPECT to DEAD. An ACTIVE agent has to pass through SUSPECT first.
     */
    public boolean markDead(String id) {
        return transition(id, AgentStatus.SUSPECT, AgentStatus.DEAD);
    }

    /**
     * Removes DEAD records whose status changed more than {@code retention} ago.
     */
    public List<String> purgeDead(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        List<AgentRecord> purged = new ArrayList<>();
        lock.writeLock().lock();
        try {
            Iterator<AgentRecord> it = agents.values().iterator();
            while (it.hasNext()) {
                AgentRecord record = it.next();
                if (record.status() == AgentStatus.DEAD && !record.statusChangedAt().isAfter(cutoff)) {
                    it.remove();
                    purged.add(record);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        List<String> ids = new ArrayList<>(purged.size());
        for (AgentRecord record : purged) {
            ids.add(record.id());
            notifyListeners(record, null);
        }
        if (!ids.isEmpty()) {
            logger.info("purged dead agents {}", ids);
        }
        return ids;
    }

    public RegistryStats stats() {
        lock.readLock().lock();
        try {
            Map<AgentStatus, Integer> byStatus = new EnumMap<>(AgentStatus.class);
            for (AgentStatus status : AgentStatus.values()) {
                byStatus.put(status, 0);
            }
            Map<String, Integer> byCapability = new TreeMap<>();
            for (AgentRecord record : agents.values()) {
                byStatus.merge(record.status(), 1, Integer::sum);
                if (record.status() == AgentStatus.ACTIVE) {
                    for (String capability : record.capabilities()) {
                        byCapability.merge(capability, 1, Integer::sum);
                    }
                }
            }
            return new RegistryStats(agents.size(), byStatus, byCapability);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return agents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean transition(String id, AgentStatus from, AgentStatus to) {
        AgentRecord before;
        AgentRecord after;
        lock.writeLock().lock();
        try {
            before = agents.get(id);
            if (before == null || before.status() != from) {
                return false;
            }
            after = before.withStatus(to, clock.instant());
            agents.put(id, after);
        } finally {
            lock.writeLock().unlock();
        }
        logger.warn("agent {} {} -> {} (last heartbeat {})", id, from, to, before.lastHeartbeat());
        notifyListeners(before, after);
        return true;
    }

    private void notifyListeners(AgentRecord before, AgentRecord after) {
        for (MembershipListener listener : listeners) {
            try {
                listener.onChange(before, after);
            } catch (RuntimeException e) {
                logger.warn("membership listener failed", e);
            }
        }
    }
}
