package io.mindmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;

public record TaskOutcome(
        boolean success,
        JsonNode output,
        String error
) {
    public static TaskOutcome ok(JsonNode output) {
        return new TaskOutcome(true, output, null);
    }

    public static TaskOutcome fail(String error) {
        return new TaskOutcome(false, null, error);
    }
}
