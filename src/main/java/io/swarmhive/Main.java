package io.swarmhive;

import io.swarmhive.cli.HiveCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new HiveCommand()).execute(args);
        System.exit(code);
    }
}
