package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.IntentEngine;
import com.switchboard.core.model.ResolutionMode;
import com.switchboard.core.model.ResolvedIntent;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchboard resolve "&lt;message&gt;"
 * <p>
 * Resolves one message and prints the structured intent. Exits 1 when the
 * message resolves to {@code unknown}, 2 on an invalid mode.
 */
@Command(name = "resolve", mixinStandardHelpOptions = true, description = "Resolve a message to an intent")
@Component
public class ResolveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language message")
    String message;

    @Option(names = {"--mode", "-m"},
            description = "Resolution mode: rules, generative, hybrid",
            defaultValue = "hybrid")
    String mode;

    private final IntentEngine intentEngine;

    public ResolveCommand(IntentEngine intentEngine) {
        this.intentEngine = intentEngine;
    }

    @Override
    public Integer call() {
        ResolutionMode resolutionMode;
        try {
            resolutionMode = ResolutionMode.fromValue(mode);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid mode: " + mode + ". Valid modes: rules, generative, hybrid");
            return 2;
        }
        ResolvedIntent result = intentEngine.resolve(message, null, resolutionMode);
        ConsoleOutput.intent(result);
        return result.isUnknown() ? 1 : 0;
    }
}
