package io.jobrelay;

import io.jobrelay.cli.JobRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new JobRelayCommand()).execute(args);
        System.exit(code);
    }
}
