package io.mindmesh.state;

@FunctionalInterface
public interface StateWriteListener {
    void onLocalWrite(StateEntry entry);
}
