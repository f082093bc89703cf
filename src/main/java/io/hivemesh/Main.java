package io.hivemesh;

import io.hivemesh.cli.HiveMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new HiveMeshCommand()).execute(args);
        System.exit(code);
    }
}
