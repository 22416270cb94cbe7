package io.avscheduler;

import io.avscheduler.cli.AvSchedulerCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AvSchedulerCommand()).execute(args);
        System.exit(code);
    }
}
