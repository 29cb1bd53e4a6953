package dev.automate;

import dev.automate.cli.AutomateCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new AutomateCli()).execute(args);
        System.exit(exitCode);
    }
}
