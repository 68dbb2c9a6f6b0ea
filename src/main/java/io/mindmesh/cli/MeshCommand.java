package io.mindmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mindmesh.agent.CapabilityHandlers;
import io.mindmesh.balancer.LoadBalancer;
import io.mindmesh.balancer.LoadBalancingStrategy;
import io.mindmesh.config.MeshConfig;
import io.mindmesh.config.MeshSettings;
import io.mindmesh.error.MeshException;
import io.mindmesh.recovery.FaultRecovery;
import io.mindmesh.registry.AgentRecord;
import io.mindmesh.rpc.Endpoint;
import io.mindmesh.rpc.RpcClient;
import io.mindmesh.runtime.MeshNode;
import io.mindmesh.security.MeshTls;
import io.mindmesh.util.Backoff;
import io.mindmesh.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import javax.net.ssl.SSLContext;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "mindmesh",
        mixinStandardHelpOptions = true,
        description = "MindMesh agent mesh node and operator CLI",
        subcommands = {
                MeshCommand.ServeCommand.class,
                MeshCommand.PingCommand.class,
                MeshCommand.NetRegisterCommand.class,
                MeshCommand.NetListCommand.class,
                MeshCommand.HeartbeatCommand.class,
                MeshCommand.RpcCallCommand.class,
                MeshCommand.LbAssignCommand.class,
                MeshCommand.LbStatsCommand.class,
                MeshCommand.StateSetCommand.class,
                MeshCommand.StateGetCommand.class,
                MeshCommand.StateDeleteCommand.class,
                MeshCommand.TaskSubmitCommand.class,
                MeshCommand.TaskGetCommand.class,
                MeshCommand.MetricsCommand.class,
                MeshCommand.HealthCommand.class
        }
)
public final class MeshCommand implements Runnable {
    static final int INVALID_ARGUMENT_EXIT_CODE = 2;

    @Spec
    CommandSpec spec;

    @Option(names = {"--settings"}, defaultValue = MeshConfig.SETTINGS_FILE, description = "Settings file (JSON)")
    String settingsFile;

    @Option(names = {"--host"}, description = "Target node host for client commands, bind host for serve")
    String host;

    @Option(names = {"--port"}, description = "Target node port for client commands, listen port for serve")
    Integer port;

    @Option(names = {"--timeout-ms"}, description = "Call timeout in milliseconds")
    Long timeoutMs;

    @Option(names = {"--tls"}, defaultValue = "false", description = "Connect with TLS")
    boolean tls;

    @Option(names = {"--truststore"}, description = "PKCS12 truststore used to verify the node certificate")
    String truststore;

    @Option(names = {"--truststore-pass"}, description = "Truststore password")
    String truststorePass;

    @Option(names = {"--insecure"}, defaultValue = "false", description = "With --tls, accept any server certificate")
    boolean insecure;

    /**
     * Command line with mesh errors mapped to exit codes and {@code error[KIND]: message} on stderr.
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new MeshCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof MeshException mesh) {
                commandLine.getErr().println("error[" + mesh.kind() + "]: " + mesh.getMessage());
                commandLine.getErr().flush();
                return mesh.kind().exitCode();
            }
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("error[INVALID_ARGUMENT]: " + ex.getMessage());
                commandLine.getErr().flush();
                return INVALID_ARGUMENT_EXIT_CODE;
            }
            throw ex;
        });
        return cmd;
    }

    @Override
    public void run() {
        spec.commandLine().usage(out());
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    void print(JsonNode node) {
        out().println(Jsons.toJson(node));
        out().flush();
    }

    MeshSettings settings(ObjectNode overrides) throws Exception {
        ObjectNode merged = Jsons.object();
        if (host != null) {
            merged.put("bindHost", host);
        }
        if (port != null) {
            merged.put("port", port);
        }
        if (timeoutMs != null) {
            merged.put("callTimeoutMs", timeoutMs);
        }
        if (truststore != null) {
            merged.put("tlsTruststore", truststore);
        }
        if (truststorePass != null) {
            merged.put("tlsTruststorePassword", truststorePass);
        }
        if (insecure) {
            merged.put("tlsInsecure", true);
        }
        if (overrides != null) {
            merged.setAll(overrides);
        }
        return MeshConfig.load(settingsFile == null ? null : Path.of(settingsFile), merged);
    }

    Endpoint target() throws Exception {
        MeshSettings settings = settings(null);
        return new Endpoint(settings.advertisedHost(), settings.port());
    }

    RpcClient client() throws Exception {
        MeshSettings settings = settings(null);
        SSLContext context = null;
        if (tls || insecure || truststore != null) {
            context = insecure
                    ? MeshTls.trustAllContext()
                    : MeshTls.clientContext(MeshTls.TlsSettings.client(
                    settings.tls().truststorePath(), settings.tls().truststorePassword()));
        }
        return new RpcClient(new RpcClient.Options(
                settings.connectTimeout(),
                settings.callTimeout(),
                settings.backoff(),
                context,
                settings.maxFrameBytes()
        ));
    }

    JsonNode call(String method, JsonNode params) throws Exception {
        Endpoint endpoint = target();
        try (RpcClient client = client()) {
            return client.call(endpoint, method, params);
        }
    }

    /**
     * Like {@link #call(String, JsonNode)} for read-only methods, which are retried on
     * connection failures and timeouts.
     */
    JsonNode read(String method, JsonNode params) throws Exception {
        Endpoint endpoint = target();
        Backoff backoff = settings(null).backoff();
        try (RpcClient client = client()) {
            return FaultRecovery.retryIdempotent(() -> client.call(endpoint, method, params), backoff);
        }
    }

    @Command(name = "serve", description = "Run a mesh node until interrupted")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Option(names = {"--node-id"}, description = "Node / agent id")
        String nodeId;

        @Option(names = {"--advertise-host"}, description = "Host other nodes use to reach this one")
        String advertiseHost;

        @Option(names = {"--capability"}, description = "Capability served by this node (repeatable)")
        List<String> capabilities;

        @Option(names = {"--peer"}, description = "State replication peer host:port (repeatable)")
        List<String> peers;

        @Option(names = {"--coordinator"}, description = "Registry node to register with (host:port)")
        String coordinator;

        @Option(names = {"--keystore"}, description = "PKCS12 keystore; enables the TLS listener")
        String keystore;

        @Option(names = {"--keystore-pass"}, description = "Keystore password")
        String keystorePass;

        @Option(names = {"--require-client-auth"}, defaultValue = "false", description = "Require client certificates")
        boolean requireClientAuth;

        @Option(names = {"--revocation-file"}, description = "Revocation list (serial:<hex> / sha256:<hex>)")
        String revocationFile;

        @Option(names = {"--audit-dir"}, description = "Directory for the JSON-lines audit trail")
        String auditDir;

        @Override
        public Integer call() throws Exception {
            ObjectNode overrides = Jsons.object();
            putIfSet(overrides, "nodeId", nodeId);
            putIfSet(overrides, "advertisedHost", advertiseHost);
            putIfSet(overrides, "coordinator", coordinator);
            putIfSet(overrides, "tlsKeystore", keystore);
            putIfSet(overrides, "tlsKeystorePassword", keystorePass);
            putIfSet(overrides, "tlsRevocationFile", revocationFile);
            putIfSet(overrides, "auditDir", auditDir);
            if (requireClientAuth) {
                overrides.put("tlsRequireClientAuth", true);
            }
            if (capabilities != null) {
                overrides.set("capabilities", Jsons.toTree(capabilities));
            }
            if (peers != null) {
                overrides.set("peers", Jsons.toTree(peers));
            }
            MeshSettings settings = parent.settings(overrides);
            MeshNode node = new MeshNode(settings, CapabilityHandlers.builtIns(), Clock.systemUTC());
            int bound = node.start();
            Runtime.getRuntime().addShutdownHook(new Thread(node::stop, "mindmesh-shutdown"));
            parent.out().println("MindMesh node " + settings.nodeId() + " listening on "
                    + settings.bindHost() + ":" + bound
                    + ", tls=" + settings.tls().serverEnabled()
                    + ", capabilities=" + settings.capabilities()
                    + ", peers=" + settings.peers());
            parent.out().flush();
            Thread.currentThread().join();
            return 0;
        }

        private static void putIfSet(ObjectNode node, String field, String value) {
            if (value != null && !value.isBlank()) {
                node.put(field, value);
            }
        }
    }

    @Command(name = "ping", description = "Check that a node answers")
    static final class PingCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Override
        public Integer call() throws Exception {
            parent.print(parent.read("mesh.ping", Jsons.object()));
            return 0;
        }
    }

    @Command(name = "net-register", description = "Register an agent with the node's registry")
    static final class NetRegisterCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Parameters(index = "0", description = "Agent id")
        String agentId;

        @Parameters(index = "1", description = "Agent host")
        String agentHost;

        @Parameters(index = "2", description = "Agent port")
        int agentPort;

        @Parameters(index = "3..*", arity = "0..*", description = "Capabilities")
        List<String> capabilities;

        @Override
        public Integer call() throws Exception {
            ObjectNode params = Jsons.object();
            params.put("agentId", agentId);
            params.put("host", agentHost);
            params.put("port", agentPort);
            params.set("capabilities", Jsons.toTree(capabilities == null ? List.of() : capabilities));
            parent.print(parent.call("registry.register", params));
            return 0;
        }
    }

    @Command(name = "net-list", description = "List agents, optionally only ACTIVE ones with a capability")
    static final class NetListCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Capability filter")
        String capability;

        @Override
        public Integer call() throws Exception {
            ObjectNode params = Jsons.object();
            if (capability != null) {
                params.put("capability", capability);
            }
            parent.print(parent.read("registry.list", params));
            return 0;
        }
    }

    @Command(name = "heartbeat", description = "Send one heartbeat for an agent")
    static final class HeartbeatCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Parameters(index = "0", description = "Agent id")
        String agentId;

        @Override
        public Integer call() throws Exception {
            ObjectNode params = Jsons.object();
            params.put("agentId", agentId);
            parent.print(parent.call("registry.heartbeat", params));
            return 0;
        }
    }

    @Command(name = "rpc-call", description = "Call any RPC method on the node, or on an agent picked by capability")
    static final class RpcCallCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Parameters(index = "0", description = "Method name")
        String method;

        @Parameters(index = "1", arity = "0..1", defaultValue = "{}", description = "JSON params")
        String params;

        @Option(names = {"--capability"}, description = "Discover the target agent by capability through the node's registry")
        String capability;

        @Option(names = {"--strategy"}, defaultValue = "round_robin", description = "Selection strategy with --capability")
        String strategy;

        @Override
        public Integer call() throws Exception {
            JsonNode body = Jsons.parseLenient(params);
            if (capability == null) {
                parent.print(parent.call(method, body));
                return 0;
            }
            Endpoint registryNode = parent.target();
            try (RpcClient client = parent.client()) {
                ObjectNode query = Jsons.object();
                query.put("capability", capability);
                JsonNode listed = client.call(registryNode, "registry.list", query);
                List<AgentRecord> agents = new ArrayList<>();
                for (JsonNode node : listed.path("agents")) {
                    agents.add(Jsons.convert(node, AgentRecord.class));
                }
                AgentRecord chosen = new LoadBalancer(1).select(capability, agents, LoadBalancingStrategy.parse(strategy));
                parent.print(client.call(chosen.endpoint(), method, body));
            }
            return 0;
        }
    }

    @Command(name = "lb-assign", description = "Assign a task: lb-assign <taskId> [agentIds...] <strategy>")
    static final class LbAssignCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Parameters(arity = "2..*", description = "Task id, candidate agent ids, strategy")
        List<String> args;

        @Option(names = {"--capability"}, description = "Capability for a task that does not exist yet")
        String capability;

        @Option(names = {"--payload"}, description = "JSON payload for a task that does not exist yet")
        String payload;

        @Override
        public Integer call() throws Exception {
            ObjectNode params = Jsons.object();
            params.put("taskId", args.get(0));
            params.put("strategy", LoadBalancingStrategy.parse(args.get(args.size() - 1)).wireName());
            params.set("agentIds", Jsons.toTree(args.subList(1, args.size() - 1)));
            if (capability != null) {
                params.put("capability", capability);
            }
            if (payload != null) {
                params.set("payload", Jsons.parseLenient(payload));
            }
            parent.print(parent.call("lb.assign", params));
            return 0;
        }
    }

    @Command(name = "lb-stats", description = "Show load balancer counters")
    static final class LbStatsCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Override
        public Integer call() throws Exception {
            parent.print(parent.read("lb.stats", Jsons.object()));
            return 0;
        }
    }

    @Command(name = "state-set", description = "Write a replicated key")
    static final class StateSetCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Parameters(index = "0", description = "Key")
        String key;

        @Parameters(index = "1", description = "Value (JSON, or plain text stored as a string)")
        String value;

        @Override
        public Integer call() throws Exception {
            ObjectNode params = Jsons.object();
            params.put("key", key);
            params.set("value", Jsons.parseLenient(value));
            parent.print(parent.call("state.set", params));
            return 0;
        }
    }

    @Command(name = "state-get", description = "Read a replicated key")
    static final class StateGetCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Parameters(index = "0", description = "Key")
        String key;

        @Override
        public Integer call() throws Exception {
            ObjectNode params = Jsons.object();
            params.put("key", key);
            parent.print(parent.read("state.get", params));
            return 0;
        }
    }

    @Command(name = "state-delete", description = "Delete a replicated key")
    static final class StateDeleteCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Parameters(index = "0", description = "Key")
        String key;

        @Override
        public Integer call() throws Exception {
            ObjectNode params = Jsons.object();
            params.put("key", key);
            parent.print(parent.call("state.delete", params));
            return 0;
        }
    }

    @Command(name = "task-submit", description = "Submit a task for dispatch")
    static final class TaskSubmitCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Parameters(index = "0", description = "Required capability")
        String capability;

        @Parameters(index = "1", arity = "0..1", defaultValue = "{}", description = "Task payload (JSON)")
        String payload;

        @Option(names = {"--task-id"}, description = "Task id (generated when omitted)")
        String taskId;

        @Override
        public Integer call() throws Exception {
            ObjectNode params = Jsons.object();
            if (taskId != null) {
                params.put("taskId", taskId);
            }
            params.put("capability", capability);
            params.set("payload", Jsons.parseLenient(payload));
            parent.print(parent.call("task.submit", params));
            return 0;
        }
    }

    @Command(name = "task-get", description = "Show a task")
    static final class TaskGetCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() throws Exception {
            ObjectNode params = Jsons.object();
            params.put("taskId", taskId);
            parent.print(parent.read("task.get", params));
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print node metrics in Prometheus text format")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Override
        public Integer call() throws Exception {
            JsonNode reply = parent.read("metrics", Jsons.object());
            parent.out().print(reply.path("text").asText(""));
            parent.out().flush();
            return 0;
        }
    }

    @Command(name = "health", description = "Show agent health and, optionally, recent failures")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        MeshCommand parent;

        @Option(names = "--failures", description = "Also list recent failures")
        boolean failures;

        @Option(names = "--agent", description = "Only list failures of this agent")
        String agentId;

        @Option(names = "--limit", defaultValue = "20", description = "Maximum failures to list (default: ${DEFAULT-VALUE})")
        int limit;

        @Override
        public Integer call() throws Exception {
            parent.print(parent.read("recovery.health", Jsons.object()));
            if (failures) {
                ObjectNode params = Jsons.object();
                if (agentId != null) {
                    params.put("agentId", agentId);
                }
                params.put("limit", limit);
                parent.print(parent.read("recovery.failures", params));
            }
            return 0;
        }
    }
}
