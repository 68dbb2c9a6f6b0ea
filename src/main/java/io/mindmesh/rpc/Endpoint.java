package io.mindmesh.rpc;

import java.util.ArrayList;
import java.util.List;

public record Endpoint(String host, int port) {
    public Endpoint {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("endpoint host cannot be empty");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("invalid endpoint port: " + port);
        }
        host = host.trim();
    }

    public static Endpoint parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be empty");
        }
        String trimmed = raw.trim();
        int sep = trimmed.lastIndexOf(':');
        if (sep <= 0 || sep == trimmed.length() - 1) {
            throw new IllegalArgumentException("endpoint must be host:port: " + raw);
        }
        try {
            return new Endpoint(trimmed.substring(0, sep), Integer.parseInt(trimmed.substring(sep + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("endpoint port is not a number: " + raw, e);
        }
    }

    public static List<Endpoint> parseAll(List<String> raw) {
        List<Endpoint> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String item : raw) {
            if (item == null || item.isBlank()) {
                continue;
            }
            Endpoint endpoint = parse(item);
            if (!out.contains(endpoint)) {
                out.add(endpoint);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
