package com.switchboard.dispatch.cli;

import com.switchboard.core.model.ResolvedIntent;
import picocli.CommandLine;

import java.util.Locale;
import java.util.Map;

/**
 * ANSI-colored terminal output for the Switchboard CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(ansi("@|bold,fg(yellow) SWITCHBOARD v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(ansi("@|fg(cyan) [SWITCHBOARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(ansi("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(ansi("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(ansi("@|fg(red) x|@ " + message));
    }

    public static void intent(ResolvedIntent result) {
        String color = result.isUnknown() ? "fg(red)" : "fg(green)";
        System.out.println(ansi("@|bold," + color + " " + result.intent() + "|@ "
                + String.format(Locale.ROOT, "(%.2f via %s)", result.confidence(), result.resolutionPath())));
        System.out.println("  Action:    " + result.action());
        if (result.workflow() != null) {
            System.out.println("  Workflow:  " + result.workflow());
        }
        printMap("Entities", result.entities());
        if (!result.platforms().isEmpty()) {
            System.out.println("  Platforms: " + String.join(", ", result.platforms()));
        }
        var plan = result.dataIntegration();
        if (plan != null) {
            System.out.println(ansi("  @|fg(magenta) [INTEGRATION]|@ "
                    + String.join(",", plan.sourcePlatforms()) + " -> "
                    + String.join(",", plan.targetPlatforms()) + " (" + plan.syncOperation().wireName() + ")"));
        }
        if (result.requiresConfirmation()) {
            warn("Confirmation required");
        }
        for (String suggestion : result.suggestedResponses()) {
            System.out.println(ansi("    @|fg(blue) >|@ " + suggestion));
        }
    }

    private static void printMap(String label, Map<String, Object> values) {
        if (values.isEmpty()) {
            return;
        }
        System.out.println("  " + label + ":");
        values.forEach((k, v) -> System.out.printf("    %-14s %s%n", k, v));
    }

    private static String ansi(String markup) {
        return CommandLine.Help.Ansi.AUTO.string(markup);
    }
}
