package com.switchboard.core.health;

import com.switchboard.core.catalog.IntentCatalog;
import com.switchboard.core.llm.LlmProperties;
import com.switchboard.core.training.TrainingLogRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final IntentCatalog catalog;
    private final LlmProperties llmProperties;
    private final TrainingLogRepository trainingLogRepository;

    public HealthCheckService(
            @Autowired(required = false) IntentCatalog catalog,
            @Autowired(required = false) LlmProperties llmProperties,
            @Autowired(required = false) TrainingLogRepository trainingLogRepository) {
        this.catalog = catalog;
        this.llmProperties = llmProperties;
        this.trainingLogRepository = trainingLogRepository;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCatalog());
        results.add(checkGenerative());
        results.add(checkTrainingLog());
        return results;
    }

    private HealthStatus checkCatalog() {
        if (catalog == null) {
            return new HealthStatus("catalog", HealthStatus.Status.DOWN,
                    "Intent catalog not available", Map.of());
        }
        var metadata = Map.of(
                "intents", String.valueOf(catalog.snapshot().size()),
                "source", catalog.source());
        if (catalog.isDefaulted()) {
            return new HealthStatus("catalog", HealthStatus.Status.DEGRADED,
                    "Configured catalog could not be loaded, using built-in intents", metadata);
        }
        return new HealthStatus("catalog", HealthStatus.Status.UP,
                "Intent catalog loaded", metadata);
    }

    private HealthStatus checkGenerative() {
        if (llmProperties == null || !llmProperties.isEnabled()) {
            return new HealthStatus("generative", HealthStatus.Status.DEGRADED,
                    "Generative classification disabled", Map.of());
        }
        if (!llmProperties.hasOpenaiKey()) {
            return new HealthStatus("generative", HealthStatus.Status.DEGRADED,
                    "No OpenAI API key configured", Map.of("provider", llmProperties.getProvider()));
        }
        return new HealthStatus("generative", HealthStatus.Status.UP,
                "Generative classifier configured", Map.of("provider", llmProperties.getProvider()));
    }

    private HealthStatus checkTrainingLog() {
        if (trainingLogRepository == null) {
            return new HealthStatus("training", HealthStatus.Status.DOWN,
                    "Training log not available", Map.of());
        }
        var metadata = Map.of("location", trainingLogRepository.location().toString());
        if (trainingLogRepository.isWritable()) {
            return new HealthStatus("training", HealthStatus.Status.UP,
                    "Training log directory writable", metadata);
        }
        return new HealthStatus("training", HealthStatus.Status.DOWN,
                "Training log directory not writable", metadata);
    }
}
