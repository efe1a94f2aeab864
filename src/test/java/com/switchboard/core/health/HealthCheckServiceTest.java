package com.switchboard.core.health;

import com.switchboard.core.catalog.IntentCatalog;
import com.switchboard.core.catalog.DefaultIntentCatalog;
import com.switchboard.core.llm.LlmProperties;
import com.switchboard.core.training.TrainingLogRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private static LlmProperties llm(boolean enabled, String key) {
        var props = new LlmProperties();
        props.setEnabled(enabled);
        props.setOpenaiApiKey(key);
        return props;
    }

    private static TrainingLogRepository repository(boolean writable) {
        var repo = mock(TrainingLogRepository.class);
        when(repo.location()).thenReturn(Path.of("/tmp/training.json"));
        when(repo.isWritable()).thenReturn(writable);
        return repo;
    }

    private static HealthStatus component(List<HealthStatus> statuses, String name) {
        return statuses.stream().filter(s -> s.component().equals(name)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("all components UP when configured")
    void allUp() {
        var catalog = IntentCatalog.of(DefaultIntentCatalog.definitions());
        var service = new HealthCheckService(catalog, llm(true, "sk-test"), repository(true));

        var statuses = service.checkAll();

        assertEquals(3, statuses.size());
        assertTrue(statuses.stream().allMatch(s -> s.status() == HealthStatus.Status.UP));
        assertEquals("in-memory", component(statuses, "catalog").metadata().get("source"));
        assertEquals("openai", component(statuses, "generative").metadata().get("provider"));
    }

    @Test
    @DisplayName("missing beans report DOWN or DEGRADED")
    void missingBeans() {
        var statuses = new HealthCheckService(null, null, null).checkAll();

        assertEquals(HealthStatus.Status.DOWN, component(statuses, "catalog").status());
        assertEquals(HealthStatus.Status.DEGRADED, component(statuses, "generative").status());
        assertEquals(HealthStatus.Status.DOWN, component(statuses, "training").status());
    }

    @Test
    @DisplayName("disabled or keyless generative classifier is DEGRADED")
    void generativeDegraded() {
        var disabled = new HealthCheckService(null, llm(false, "sk-test"), null).checkAll();
        var keyless = new HealthCheckService(null, llm(true, "not-configured"), null).checkAll();

        assertEquals(HealthStatus.Status.DEGRADED, component(disabled, "generative").status());
        assertEquals("Generative classification disabled", component(disabled, "generative").detail());
        assertEquals(HealthStatus.Status.DEGRADED, component(keyless, "generative").status());
        assertEquals("No OpenAI API key configured", component(keyless, "generative").detail());
    }

    @Test
    @DisplayName("unwritable training directory is DOWN")
    void trainingUnwritable() {
        var statuses = new HealthCheckService(null, null, repository(false)).checkAll();

        var training = component(statuses, "training");
        assertEquals(HealthStatus.Status.DOWN, training.status());
        assertEquals("/tmp/training.json", training.metadata().get("location"));
    }
}
