package io.mindmesh.agent;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mindmesh.util.Jsons;

import java.time.Instant;

public final class EchoHandler implements CapabilityHandler {
    @Override
    public String capability() {
        return "echo";
    }

    @Override
    public TaskOutcome execute(TaskContext context) {
        ObjectNode output = Jsons.object();
        output.put("agent", context.agentId());
        output.put("timestamp", Instant.now().toString());
        output.put("taskId", context.taskId());
        output.put("attempt", context.attempt());
        output.set("received", context.payload());
        return TaskOutcome.ok(output);
    }
}
