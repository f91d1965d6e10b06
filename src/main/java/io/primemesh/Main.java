package io.primemesh;

import io.primemesh.cli.PrimeMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PrimeMeshCommand()).execute(args);
        System.exit(code);
    }
}
