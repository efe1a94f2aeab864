package com.switchboard.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.model.TrainingExample;
import com.switchboard.core.model.TrainingResult;
import com.switchboard.core.training.TrainingStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: switchboard train &lt;file&gt;
 * <p>
 * Reads either a JSON array of examples or a {@code {"examples": [...]}} document.
 */
@Command(name = "train", mixinStandardHelpOptions = true, description = "Train on labelled examples from a JSON file")
@Component
public class TrainCommand implements Callable<Integer> {

    private static final TypeReference<List<TrainingExample>> EXAMPLES = new TypeReference<>() {};

    @Parameters(index = "0", description = "JSON file of training examples")
    Path file;

    private final TrainingStore trainingStore;
    private final ObjectMapper objectMapper;

    public TrainCommand(TrainingStore trainingStore, ObjectMapper objectMapper) {
        this.trainingStore = trainingStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        List<TrainingExample> examples;
        try {
            examples = readExamples(file);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 2;
        }
        if (examples.isEmpty()) {
            ConsoleOutput.error("No examples in " + file);
            return 2;
        }
        TrainingResult result = trainingStore.trainOnExamples(examples);
        ConsoleOutput.success("Trained " + result.trainedCount() + " of " + examples.size() + " examples");
        for (String error : result.errors()) {
            ConsoleOutput.error(error);
        }
        return result.success() ? 0 : 1;
    }

    List<TrainingExample> readExamples(Path path) throws IOException {
        JsonNode root = objectMapper.readTree(path.toFile());
        JsonNode array = root.isArray() ? root : root.path("examples");
        if (!array.isArray()) {
            throw new IOException("expected an array or an object with an \"examples\" array");
        }
        return objectMapper.convertValue(array, EXAMPLES);
    }
}
