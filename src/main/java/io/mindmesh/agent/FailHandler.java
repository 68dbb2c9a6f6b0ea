package io.mindmesh.agent;

public final class FailHandler implements CapabilityHandler {
    @Override
    public String capability() {
        return "fail";
    }

    @Override
    public TaskOutcome execute(TaskContext context) {
        return TaskOutcome.fail("intentional failure from fail handler");
    }
}
