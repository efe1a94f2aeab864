package com.switchboard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Switchboard.
 */
@Command(
        name = "switchboard",
        mixinStandardHelpOptions = true,
        version = "Switchboard 0.1.0",
        description = "Hybrid natural-language intent resolver",
        subcommands = {
                ResolveCommand.class,
                IntentsCommand.class,
                TrainCommand.class,
                RetrainCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwitchboardCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
