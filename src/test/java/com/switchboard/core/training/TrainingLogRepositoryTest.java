package com.switchboard.core.training;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.model.TrainingExample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TrainingLogRepositoryTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    @DisplayName("a missing log loads as empty")
    void missingLog() throws IOException {
        var repository = new TrainingLogRepository(objectMapper, tempDir.resolve("none.json"));
        assertEquals(List.of(), repository.load());
    }

    @Test
    @DisplayName("save writes a versioned document and leaves no temp files behind")
    void saveWritesDocument() throws IOException {
        Path file = tempDir.resolve("nested/training.json");
        var repository = new TrainingLogRepository(objectMapper, file);
        Instant at = Instant.parse("2026-01-02T03:04:05Z");

        repository.save(List.of(new TrainingExample("ping", "health_check", Map.of(), at, List.of(), false)), at);

        JsonNode root = objectMapper.readTree(file.toFile());
        assertEquals(TrainingLogDocument.CURRENT_VERSION, root.get("version").asText());
        assertEquals("2026-01-02T03:04:05Z", root.get("lastUpdated").asText());
        assertEquals("ping", root.get("examples").get(0).get("message").asText());
        try (var files = Files.list(file.getParent())) {
            assertEquals(1, files.count());
        }
        assertEquals(1, repository.load().size());
    }

    @Test
    @DisplayName("a writable directory is reported as writable")
    void writable() {
        assertTrue(new TrainingLogRepository(objectMapper, tempDir.resolve("log.json")).isWritable());
    }
}
