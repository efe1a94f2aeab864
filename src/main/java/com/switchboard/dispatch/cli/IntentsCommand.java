package com.switchboard.dispatch.cli;

import com.switchboard.core.catalog.IntentCatalog;
import com.switchboard.core.model.IntentDefinition;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: switchboard intents
 */
@Command(name = "intents", mixinStandardHelpOptions = true, description = "List the intent catalog")
@Component
public class IntentsCommand implements Runnable {

    @Option(names = {"--patterns", "-p"}, description = "Also print each intent's patterns")
    boolean showPatterns;

    private final IntentCatalog catalog;

    public IntentsCommand(IntentCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Catalog source: " + catalog.source()
                + (catalog.isDefaulted() ? " (defaulted)" : ""));
        for (IntentDefinition definition : catalog.snapshot()) {
            System.out.printf("  %-28s %-22s %s%n", definition.name(), definition.action(),
                    definition.crossPlatform() ? String.join(",", definition.platforms()) : "");
            if (showPatterns) {
                for (String pattern : definition.patterns()) {
                    System.out.println("      \"" + pattern + "\"");
                }
            }
        }
    }
}
