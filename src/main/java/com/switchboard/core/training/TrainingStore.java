package com.switchboard.core.training;

import com.switchboard.core.catalog.IntentCatalog;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.RetrainResult;
import com.switchboard.core.model.TrainingExample;
import com.switchboard.core.model.TrainingResult;
import com.switchboard.core.model.TrainingStats;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Online training: labelled examples teach their message to the owning intent
 * and are appended to a persistent, append-only log.
 * <p>
 * Learning only ever adds patterns and examples. Replaying the log is
 * idempotent and is done once at startup.
 */
@Service
public class TrainingStore {

    private static final Logger log = LoggerFactory.getLogger(TrainingStore.class);

    private final IntentCatalog catalog;
    private final TrainingLogRepository repository;
    private final Clock clock;
    private final SwitchboardMetrics metrics;

    private final ReentrantLock logLock = new ReentrantLock();
    private final List<TrainingExample> examples = new ArrayList<>();

    @Autowired
    public TrainingStore(IntentCatalog catalog,
                         TrainingLogRepository repository,
                         Clock clock,
                         @Autowired(required = false) SwitchboardMetrics metrics) {
        this.catalog = catalog;
        this.repository = repository;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Loads the persisted log and replays it into the catalog. An unreadable
     * log is logged and training starts from an empty log.
     */
    @PostConstruct
    public void loadAndReplay() {
        List<TrainingExample> stored;
        try {
            stored = repository.load();
        } catch (IOException e) {
            log.warn("Could not read training log {}: {}", repository.location(), e.getMessage());
            return;
        }
        logLock.lock();
        try {
            examples.clear();
            examples.addAll(stored);
        } finally {
            logLock.unlock();
        }
        if (!stored.isEmpty()) {
            retrainFromExamples();
        }
    }

    /**
     * Trains on a batch. Invalid examples and unknown intent labels are reported
     * per example and the rest of the batch continues.
     */
    public TrainingResult trainOnExamples(List<TrainingExample> batch) {
        var errors = new ArrayList<String>();
        int trained = 0;
        logLock.lock();
        try {
            for (TrainingExample example : batch) {
                if (example == null || isBlank(example.message()) || isBlank(example.intent())) {
                    errors.add("Invalid example: message and intent are required");
                    continue;
                }
                if (catalog.learn(example.intent(), example.message()).isEmpty()) {
                    errors.add("Intent not found: " + example.intent());
                    continue;
                }
                examples.add(new TrainingExample(example.message(), example.intent(), example.entities(),
                        clock.instant(), example.platforms(), example.crossPlatform()));
                trained++;
            }
            if (trained > 0) {
                try {
                    repository.save(List.copyOf(examples), clock.instant());
                } catch (IOException e) {
                    log.error("Failed to persist training log {}: {}", repository.location(), e.getMessage());
                    errors.add("Failed to persist training log: " + e.getMessage());
                }
            }
        } finally {
            logLock.unlock();
        }
        log.info("Training completed: {} examples trained, {} errors", trained, errors.size());
        if (metrics != null) {
            metrics.recordTraining(trained, errors.size());
        }
        return new TrainingResult(errors.isEmpty(), trained, errors);
    }

    /**
     * Re-applies every logged example to the catalog. Examples without a message
     * or intent, and examples whose intent no longer exists, are skipped.
     */
    public RetrainResult retrainFromExamples() {
        List<TrainingExample> snapshot = snapshot();
        int retrained = 0;
        for (TrainingExample example : snapshot) {
            if (isBlank(example.message()) || isBlank(example.intent())) {
                log.warn("Skipping invalid logged example (intent={}): message and intent are required",
                        example.intent());
                continue;
            }
            if (catalog.learn(example.intent(), example.message()).isPresent()) {
                retrained++;
            } else {
                log.debug("Skipping logged example for unknown intent {}", example.intent());
            }
        }
        log.info("Retraining completed: {} of {} examples applied", retrained, snapshot.size());
        return new RetrainResult(true, retrained);
    }

    public TrainingStats getTrainingStats() {
        List<TrainingExample> snapshot = snapshot();
        var byIntent = new LinkedHashMap<String, Integer>();
        for (TrainingExample example : snapshot) {
            byIntent.merge(example.intent(), 1, Integer::sum);
        }
        Instant oldest = snapshot.stream().map(TrainingExample::timestamp).filter(Objects::nonNull)
                .min(Comparator.naturalOrder()).orElse(null);
        Instant newest = snapshot.stream().map(TrainingExample::timestamp).filter(Objects::nonNull)
                .max(Comparator.naturalOrder()).orElse(null);
        return new TrainingStats(snapshot.size(), Collections.unmodifiableMap(byIntent), oldest, newest);
    }

    public List<TrainingExample> examples() {
        return snapshot();
    }

    private List<TrainingExample> snapshot() {
        logLock.lock();
        try {
            return List.copyOf(examples);
        } finally {
            logLock.unlock();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
