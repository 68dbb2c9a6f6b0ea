package io.mindmesh.balancer;

/**
 * Told about tasks that ran out of attempts.
 */
@FunctionalInterface
public interface TaskFailureListener {
    void onTaskFailed(TaskView task);
}
