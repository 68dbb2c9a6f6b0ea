package io.mindmesh;

import io.mindmesh.cli.MeshCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = MeshCommand.commandLine().execute(args);
        System.exit(code);
    }
}
