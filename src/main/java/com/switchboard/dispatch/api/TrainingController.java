package com.switchboard.dispatch.api;

import com.switchboard.core.model.RetrainResult;
import com.switchboard.core.model.TrainingResult;
import com.switchboard.core.model.TrainingStats;
import com.switchboard.core.training.TrainingStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for online training.
 */
@RestController
@RequestMapping("/api/v1/training")
public class TrainingController {

    private final TrainingStore trainingStore;

    public TrainingController(TrainingStore trainingStore) {
        this.trainingStore = trainingStore;
    }

    /**
     * POST /api/v1/training/examples: Train on a batch of labelled messages.
     * Per-example problems are reported in the result, not as an HTTP error.
     */
    @PostMapping("/examples")
    public ResponseEntity<?> train(@RequestBody TrainingRequest request) {
        if (request.examples() == null || request.examples().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one example is required"));
        }
        TrainingResult result = trainingStore.trainOnExamples(request.examples());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/retrain")
    public ResponseEntity<RetrainResult> retrain() {
        return ResponseEntity.ok(trainingStore.retrainFromExamples());
    }

    @GetMapping("/stats")
    public ResponseEntity<TrainingStats> stats() {
        return ResponseEntity.ok(trainingStore.getTrainingStats());
    }
}
