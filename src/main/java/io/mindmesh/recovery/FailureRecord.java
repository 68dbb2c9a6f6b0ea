package io.mindmesh.recovery;

/**
 * One failure attributed to an agent. {@code taskId} is null when no task was involved, and
 * {@code recoveredAtMs} is null until the agent has succeeded again.
 */
public record FailureRecord(
        String id,
        String agentId,
        String errorType,
        String message,
        String taskId,
        long atMs,
        boolean recovered,
        Long recoveredAtMs
) {
}
