package com.switchboard.dispatch.cli;

import com.switchboard.core.training.TrainingStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: switchboard retrain
 */
@Command(name = "retrain", mixinStandardHelpOptions = true, description = "Replay the training log into the catalog")
@Component
public class RetrainCommand implements Runnable {

    private final TrainingStore trainingStore;

    public RetrainCommand(TrainingStore trainingStore) {
        this.trainingStore = trainingStore;
    }

    @Override
    public void run() {
        var result = trainingStore.retrainFromExamples();
        var stats = trainingStore.getTrainingStats();
        ConsoleOutput.success("Retrained " + result.retrained() + " of " + stats.totalExamples() + " logged examples");
    }
}
