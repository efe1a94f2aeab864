package com.switchboard.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: switchboard serve
 * <p>
 * Runs the REST API. {@link com.switchboard.SwitchboardApplication#main} enables
 * the servlet stack when "serve" is present and {@link CliRunner} then skips
 * picocli, so this command only prints its banner once Tomcat is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Switchboard HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Switchboard listening on port " + port);
        System.out.println();
        System.out.println("  Resolve:  POST http://localhost:" + port + "/api/v1/intents/resolve");
        System.out.println("  Health:   GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
    }
}
