package com.switchboard.core.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.config.SwitchboardProperties;
import com.switchboard.core.match.PatternMatcher;
import com.switchboard.core.model.IntentDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class IntentCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("learn adds the lowercased message as a pattern and keeps the original as an example")
    void learnAddsPatternAndExample() {
        var catalog = IntentCatalog.of(DefaultIntentCatalog.definitions());

        IntentDefinition updated = catalog.learn("create_task", "Jot Down A Reminder").orElseThrow();

        assertTrue(updated.patterns().contains("jot down a reminder"));
        assertTrue(updated.examples().contains("Jot Down A Reminder"));
        assertEquals(updated, catalog.find("create_task").orElseThrow());
    }

    @Test
    @DisplayName("learning the same message twice is idempotent")
    void learnIsIdempotent() {
        var catalog = IntentCatalog.of(DefaultIntentCatalog.definitions());
        catalog.learn("create_task", "jot down a reminder");
        int patterns = catalog.find("create_task").orElseThrow().patterns().size();

        catalog.learn("create_task", "JOT DOWN A REMINDER");

        assertEquals(patterns, catalog.find("create_task").orElseThrow().patterns().size());
    }

    @Test
    @DisplayName("learn on an unknown intent changes nothing")
    void learnUnknownIntent() {
        var catalog = IntentCatalog.of(DefaultIntentCatalog.definitions());
        List<IntentDefinition> before = catalog.snapshot();
        assertTrue(catalog.learn("teleport", "beam me up").isEmpty());
        assertEquals(before, catalog.snapshot());
    }

    @Test
    @DisplayName("snapshots are unaffected by later learning")
    void snapshotIsStable() {
        var catalog = IntentCatalog.of(DefaultIntentCatalog.definitions());
        List<IntentDefinition> snapshot = catalog.snapshot();
        catalog.learn("create_task", "jot down a reminder");
        assertFalse(snapshot.stream().filter(d -> d.name().equals("create_task")).findFirst().orElseThrow()
                .patterns().contains("jot down a reminder"));
    }

    @Test
    @DisplayName("replaceAll swaps the catalog and rejects duplicates")
    void replaceAll() {
        var catalog = IntentCatalog.of(DefaultIntentCatalog.definitions());
        var single = IntentDefinition.simple("ping", "", List.of("ping"), List.of(), List.of(), "pong", null);

        catalog.replaceAll(List.of(single));
        assertEquals(List.of(single), catalog.snapshot());
        assertEquals("import", catalog.source());

        assertThrows(CatalogValidationException.class, () -> catalog.replaceAll(List.of(single, single)));
        assertEquals(List.of(single), catalog.snapshot());
    }

    @Test
    @DisplayName("reload re-reads the configured file and drops in-memory learning")
    void reload() throws IOException {
        Path file = tempDir.resolve("intents.json");
        Files.writeString(file, "{\"intents\": [{\"name\": \"ping\", \"patterns\": [\"ping\"]}]}");
        var properties = new SwitchboardProperties();
        properties.getCatalog().setLocation(file.toString());
        var catalog = new IntentCatalog(new IntentCatalogLoader(new ObjectMapper()), properties);

        catalog.learn("ping", "are you there");
        assertEquals(2, catalog.find("ping").orElseThrow().patterns().size());

        catalog.reload();
        assertEquals(List.of("ping"), catalog.find("ping").orElseThrow().patterns());
        assertFalse(catalog.isDefaulted());
    }

    @Test
    @DisplayName("a standalone catalog cannot reload")
    void standaloneReload() {
        var catalog = IntentCatalog.of(DefaultIntentCatalog.definitions());
        assertThrows(IllegalStateException.class, catalog::reload);
    }

    @Test
    @DisplayName("learn rejects a missing message")
    void learnRejectsMissingMessage() {
        var catalog = IntentCatalog.of(DefaultIntentCatalog.definitions());
        List<IntentDefinition> before = catalog.snapshot();

        assertThrows(IllegalArgumentException.class, () -> catalog.learn("create_task", null));
        assertThrows(IllegalArgumentException.class, () -> catalog.learn("create_task", "  "));
        assertEquals(before, catalog.snapshot());
    }

    @Test
    @DisplayName("readers always see a consistent catalog while learning and imports run")
    void concurrentReadersSeeConsistentSnapshots() throws Exception {
        var catalog = IntentCatalog.of(DefaultIntentCatalog.definitions());
        var matcher = new PatternMatcher(catalog);
        var failure = new AtomicReference<Throwable>();
        var writersDone = new AtomicBoolean(false);
        var start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(6);
        try {
            for (int r = 0; r < 4; r++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        while (!writersDone.get() && failure.get() == null) {
                            List<IntentDefinition> snapshot = catalog.snapshot();
                            var names = new HashSet<String>();
                            for (IntentDefinition definition : snapshot) {
                                assertTrue(names.add(definition.name()), "duplicate " + definition.name());
                                long learnedExamples = definition.examples().stream()
                                        .filter(e -> e.startsWith("learned note")).count();
                                long learnedPatterns = definition.patterns().stream()
                                        .filter(p -> p.startsWith("learned note")).count();
                                assertEquals(learnedExamples, learnedPatterns);
                            }
                            matcher.match("learned note 7");
                        }
                    } catch (Throwable t) {
                        failure.compareAndSet(null, t);
                    }
                    return null;
                });
            }
            var writers = new CountDownLatch(2);
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        catalog.learn("create_task", "learned note " + i);
                    }
                } catch (Throwable t) {
                    failure.compareAndSet(null, t);
                } finally {
                    writers.countDown();
                }
                return null;
            });
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        catalog.replaceAll(DefaultIntentCatalog.definitions());
                    }
                } catch (Throwable t) {
                    failure.compareAndSet(null, t);
                } finally {
                    writers.countDown();
                }
                return null;
            });

            start.countDown();
            assertTrue(writers.await(30, TimeUnit.SECONDS));
            writersDone.set(true);
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }

        assertNull(failure.get(), () -> "concurrent access failed: " + failure.get());
        assertEquals(DefaultIntentCatalog.definitions().size(), catalog.snapshot().size());
    }
}
