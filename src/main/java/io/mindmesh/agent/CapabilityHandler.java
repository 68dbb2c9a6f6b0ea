package io.mindmesh.agent;

public interface CapabilityHandler {
    String capability();

    TaskOutcome execute(TaskContext context) throws Exception;
}
