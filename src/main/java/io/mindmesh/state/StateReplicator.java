package io.mindmesh.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mindmesh.error.MeshException;
import io.mindmesh.recovery.FaultRecovery;
import io.mindmesh.rpc.Endpoint;
import io.mindmesh.rpc.RpcClient;
import io.mindmesh.util.Backoff;
import io.mindmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Pushes local writes to every peer and periodically pulls peer snapshots.
 *
 * <p>Each peer has its own worker thread and queue. The queue keeps only the newest entry per
 * key and is bounded; entries dropped from a full queue reach the peer through the next
 * snapshot pull.
 */
public final class StateReplicator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StateReplicator.class);

    public static final String APPLY_METHOD = "state.apply";
    public static final String SNAPSHOT_METHOD = "state.snapshot";
    static final int MAX_BATCH = 256;

    private final StateStore store;
    private final RpcClient client;
    private final Settings settings;
    private final List<PeerWorker> workers = new ArrayList<>();
    private ScheduledExecutorService antiEntropy;
    private volatile boolean running;

    public StateReplicator(StateStore store, RpcClient client, List<Endpoint> peers, Settings settings) {
        this.store = store;
        this.client = client;
        this.settings = settings;
        for (Endpoint peer : peers) {
            workers.add(new PeerWorker(peer));
        }
        store.addWriteListener(this::enqueue);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        for (PeerWorker worker : workers) {
            worker.thread.start();
        }
        if (!workers.isEmpty() && settings.antiEntropyInterval().toMillis() > 0) {
            antiEntropy = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "state-anti-entropy");
                thread.setDaemon(true);
                return thread;
            });
            long periodMs = settings.antiEntropyInterval().toMillis();
            antiEntropy.scheduleWithFixedDelay(this::pullAllQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
        }
        logger.info("state replication started for {} peer(s)", workers.size());
    }

    public List<Endpoint> peers() {
        List<Endpoint> out = new ArrayList<>(workers.size());
        for (PeerWorker worker : workers) {
            out.add(worker.peer);
        }
        return out;
    }

    /**
     * Pulls one peer's snapshot and merges it. Returns how many entries were accepted. The pull
     * is read-only, so it is retried on connection failures and timeouts.
     */
    public int pullFrom(Endpoint peer) {
        JsonNode response = FaultRecovery.retryIdempotent(
                () -> client.call(peer, SNAPSHOT_METHOD, Jsons.object(), settings.callTimeout()),
                settings.retryBackoff());
        return store.mergeAll(decodeEntries(response));
    }

    public Map<String, Integer> queueDepths() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (PeerWorker worker : workers) {
            out.put(worker.peer.toString(), worker.depth());
        }
        return out;
    }

    public long droppedEntries() {
        long dropped = 0;
        for (PeerWorker worker : workers) {
            dropped += worker.dropped();
        }
        return dropped;
    }

    public static ObjectNode encodeEntries(List<StateEntry> entries) {
        ObjectNode body = Jsons.object();
        ArrayNode array = body.putArray("entries");
        for (StateEntry entry : entries) {
            array.add(Jsons.toTree(entry));
        }
        return body;
    }

    public static List<StateEntry> decodeEntries(JsonNode body) {
        JsonNode array = body == null ? null : body.get("entries");
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException("expected an 'entries' array");
        }
        List<StateEntry> out = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            out.add(Jsons.convert(node, StateEntry.class));
        }
        return out;
    }

    @Override
    public synchronized void close() {
        running = false;
        if (antiEntropy != null) {
            antiEntropy.shutdownNow();
        }
        for (PeerWorker worker : workers) {
            worker.thread.interrupt();
        }
        for (PeerWorker worker : workers) {
            try {
                worker.thread.join(1_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void enqueue(StateEntry entry) {
        for (PeerWorker worker : workers) {
            worker.offer(entry);
        }
    }

    private void pullAllQuietly() {
        for (PeerWorker worker : workers) {
            try {
                int accepted = pullFrom(worker.peer);
                if (accepted > 0) {
                    logger.info("anti-entropy accepted {} entr(ies) from {}", accepted, worker.peer);
                }
            } catch (MeshException | IllegalArgumentException e) {
                logger.debug("anti-entropy pull from {} failed: {}", worker.peer, e.getMessage());
            }
        }
    }

    public record Settings(int queueLimit, Backoff retryBackoff, Duration callTimeout, Duration antiEntropyInterval) {
        public Settings {
            if (queueLimit < 1) {
                throw new IllegalArgumentException("queueLimit must be >= 1");
            }
        }
    }

    private final class PeerWorker {
        private final Endpoint peer;
        private final Thread thread;
        private final LinkedHashMap<String, StateEntry> queue = new LinkedHashMap<>();
        private long dropped;

        private PeerWorker(Endpoint peer) {
            this.peer = peer;
            this.thread = new Thread(this::run, "state-replicator-" + peer);
            this.thread.setDaemon(true);
        }

        private synchronized void offer(StateEntry entry) {
            StateEntry queued = queue.get(entry.key());
            if (queued != null && !entry.supersedes(queued)) {
                return;
            }
            queue.remove(entry.key());
            queue.put(entry.key(), entry);
            if (queue.size() > settings.queueLimit()) {
                Iterator<String> eldest = queue.keySet().iterator();
                eldest.next();
                eldest.remove();
                dropped++;
            }
            notifyAll();
        }

        private synchronized int depth() {
            return queue.size();
        }

        private synchronized long dropped() {
            return dropped;
        }

        private synchronized List<StateEntry> awaitBatch() throws InterruptedException {
            while (queue.isEmpty()) {
                wait();
            }
            List<StateEntry> batch = new ArrayList<>(Math.min(queue.size(), MAX_BATCH));
            for (StateEntry entry : queue.values()) {
                if (batch.size() >= MAX_BATCH) {
                    break;
                }
                batch.add(entry);
            }
            return batch;
        }

        // Only entries still current in the queue are removed; newer writes stay queued.
        private synchronized void acknowledge(List<StateEntry> sent) {
            for (StateEntry entry : sent) {
                queue.remove(entry.key(), entry);
            }
        }

        private void run() {
            int failures = 0;
            while (running && !Thread.currentThread().isInterrupted()) {
                try {
                    List<StateEntry> batch = awaitBatch();
                    client.call(peer, APPLY_METHOD, encodeEntries(batch), settings.callTimeout());
                    acknowledge(batch);
                    failures = 0;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (MeshException e) {
                    failures++;
                    Duration delay = settings.retryBackoff().delayBefore(failures);
                    logger.debug("replication to {} failed (attempt {}), retrying in {}ms: {}",
                            peer, failures, delay.toMillis(), e.getMessage());
                    try {
                        Thread.sleep(delay.toMillis());
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                }
            }
        }
    }
}
