package com.switchboard.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands command-line arguments to picocli once the Spring context is up.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SwitchboardCommand switchboardCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SwitchboardCommand switchboardCommand, IFactory factory) {
        this.switchboardCommand = switchboardCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // The embedded server owns the process in serve mode.
        if (isServe(args)) {
            return;
        }
        exitCode = new CommandLine(switchboardCommand, factory).execute(args);
    }

    static boolean isServe(String... args) {
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
