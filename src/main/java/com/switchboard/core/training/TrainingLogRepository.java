package com.switchboard.core.training;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.switchboard.core.config.SwitchboardProperties;
import com.switchboard.core.model.TrainingExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;

/**
 * Reads and writes the training log as a JSON document.
 * <p>
 * Writes go to a temporary file in the target directory which is then moved
 * over the log, so readers see either the old or the new document.
 */
@Repository
public class TrainingLogRepository {

    private static final Logger log = LoggerFactory.getLogger(TrainingLogRepository.class);

    private final ObjectMapper objectMapper;
    private final Path location;

    @Autowired
    public TrainingLogRepository(ObjectMapper objectMapper, SwitchboardProperties properties) {
        this(objectMapper, Path.of(properties.getTrainingLocation()));
    }

    TrainingLogRepository(ObjectMapper objectMapper, Path location) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.location = location.toAbsolutePath();
    }

    public Path location() {
        return location;
    }

    /**
     * @return the stored examples, empty when no log exists yet
     * @throws IOException when the log exists but cannot be read or parsed
     */
    public List<TrainingExample> load() throws IOException {
        if (!Files.exists(location)) {
            log.info("No training log at {}", location);
            return List.of();
        }
        TrainingLogDocument document = objectMapper.readValue(location.toFile(), TrainingLogDocument.class);
        log.info("Loaded {} training examples from {}", document.examples().size(), location);
        return document.examples();
    }

    public void save(List<TrainingExample> examples, Instant lastUpdated) throws IOException {
        Path directory = location.getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, location.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(),
                    new TrainingLogDocument(TrainingLogDocument.CURRENT_VERSION, lastUpdated, examples));
            try {
                Files.move(temp, location, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, replacing in place", directory);
                Files.move(temp, location, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Saved {} training examples to {}", examples.size(), location);
    }

    /**
     * True when the log's directory exists (or can be created) and is writable.
     */
    public boolean isWritable() {
        Path directory = location.getParent();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.debug("Training log directory {} cannot be created: {}", directory, e.getMessage());
            return false;
        }
        return Files.isWritable(directory);
    }
}
