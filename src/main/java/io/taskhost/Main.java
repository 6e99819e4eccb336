package io.taskhost;

import io.taskhost.cli.TaskHostCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TaskHostCommand()).execute(args);
        System.exit(code);
    }
}
