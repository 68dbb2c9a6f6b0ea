package io.mindmesh.agent;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capabilities this process can execute, by name.
 */
public final class CapabilityHandlers {
    private final Map<String, CapabilityHandler> handlers = new ConcurrentHashMap<>();

    public static CapabilityHandlers builtIns() {
        CapabilityHandlers out = new CapabilityHandlers();
        out.register(new EchoHandler());
        out.register(new FailHandler());
        return out;
    }

    public void register(CapabilityHandler handler) {
        handlers.put(handler.capability(), handler);
    }

    public Optional<CapabilityHandler> find(String capability) {
        return Optional.ofNullable(handlers.get(capability));
    }

    public Set<String> capabilities() {
        return new TreeSet<>(handlers.keySet());
    }
}
