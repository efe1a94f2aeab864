package com.switchboard.dispatch.cli;

import com.switchboard.core.health.HealthCheckService;
import com.switchboard.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: switchboard health
 * <p>
 * Exits 1 when any component is DOWN. DEGRADED components are reported but
 * do not fail the check.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check resolver health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        boolean anyDown = false;
        boolean anyDegraded = false;
        for (HealthStatus check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    anyDegraded = true;
                }
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
            }
        }

        System.out.println(ConsoleOutput.RULE);
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        if (anyDegraded) {
            ConsoleOutput.warn("Overall: operational with degraded components");
        } else {
            ConsoleOutput.success("Overall: all components operational");
        }
        return 0;
    }
}
