package com.switchboard.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.catalog.DefaultIntentCatalog;
import com.switchboard.core.catalog.IntentCatalog;
import com.switchboard.core.engine.IntentEngine;
import com.switchboard.core.health.HealthCheckService;
import com.switchboard.core.health.HealthStatus;
import com.switchboard.core.model.DataIntegrationPlan;
import com.switchboard.core.model.ResolutionMode;
import com.switchboard.core.model.ResolvedIntent;
import com.switchboard.core.model.RetrainResult;
import com.switchboard.core.model.SyncOperation;
import com.switchboard.core.model.TrainingExample;
import com.switchboard.core.model.TrainingResult;
import com.switchboard.core.model.TrainingStats;
import com.switchboard.core.resolver.HybridResolver;
import com.switchboard.core.training.TrainingStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises the Switchboard CLI through picocli directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private final IntentEngine engine = mock(IntentEngine.class);
    private final TrainingStore trainingStore = mock(TrainingStore.class);
    private final HealthCheckService healthCheckService = mock(HealthCheckService.class);
    private final IntentCatalog catalog = IntentCatalog.of(DefaultIntentCatalog.definitions());

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ResolveCommand.class) {
                    return (K) new ResolveCommand(engine);
                }
                if (cls == IntentsCommand.class) {
                    return (K) new IntentsCommand(catalog);
                }
                if (cls == TrainCommand.class) {
                    return (K) new TrainCommand(trainingStore, new ObjectMapper().findAndRegisterModules());
                }
                if (cls == RetrainCommand.class) {
                    return (K) new RetrainCommand(trainingStore);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new SwitchboardCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String name : List.of("resolve", "intents", "train", "retrain", "health", "serve", "help")) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Switchboard 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SWITCHBOARD"));
            assertTrue(result.output().contains("Hybrid natural-language intent resolver"));
        }
    }

    @Nested
    @DisplayName("resolve")
    class ResolveTests {

        @Test
        @DisplayName("prints the intent, entities and integration plan")
        void resolvesCrossPlatform() {
            var plan = new DataIntegrationPlan(List.of("gmail"), List.of("asana"), SyncOperation.CREATE,
                    Map.of("subject", "task_name"), List.of());
            var result = new ResolvedIntent("email_to_task", 0.9, Map.of("task_name", "invoice"), "email_to_task",
                    Map.of(), "email_task_sync", List.of("gmail", "asana"), true, plan, true,
                    List.of("Which project should the task go to?"), "rules_priority");
            when(engine.resolve(eq("turn this email into a task"), isNull(), eq(ResolutionMode.HYBRID)))
                    .thenReturn(result);

            CliResult cli = execute("resolve", "turn this email into a task");

            assertEquals(0, cli.exitCode());
            assertTrue(cli.output().contains("email_to_task"));
            assertTrue(cli.output().contains("rules_priority"));
            assertTrue(cli.output().contains("invoice"));
            assertTrue(cli.output().contains("gmail -> asana (create)"));
            assertTrue(cli.output().contains("Confirmation required"));
            assertTrue(cli.output().contains("Which project should the task go to?"));
        }

        @Test
        @DisplayName("passes --mode through")
        void modeOption() {
            when(engine.resolve(any(), any(), eq(ResolutionMode.RULES))).thenReturn(HybridResolver.unknown("x"));

            CliResult cli = execute("resolve", "--mode", "rules", "x");

            assertEquals(1, cli.exitCode(), "unknown exits 1");
            verify(engine).resolve("x", null, ResolutionMode.RULES);
        }

        @Test
        @DisplayName("rejects an invalid mode with exit code 2")
        void invalidMode() {
            CliResult cli = execute("resolve", "-m", "magic", "x");

            assertEquals(2, cli.exitCode());
            assertTrue(cli.output().contains("Invalid mode: magic"));
            verify(engine, never()).resolve(any(), any(), any());
        }

        @Test
        @DisplayName("missing message is a usage error")
        void missingMessage() {
            CliResult cli = execute("resolve");
            assertNotEquals(0, cli.exitCode());
        }
    }

    @Test
    @DisplayName("intents --patterns lists catalog entries with their patterns")
    void intentsCommand() {
        CliResult cli = execute("intents", "--patterns");

        assertEquals(0, cli.exitCode());
        assertTrue(cli.output().contains("in-memory"));
        assertTrue(cli.output().contains("create_task"));
        String firstPattern = DefaultIntentCatalog.definitions().get(0).patterns().get(0);
        assertTrue(cli.output().contains("\"" + firstPattern + "\""));
    }

    @Nested
    @DisplayName("train and retrain")
    class TrainingTests {

        @Test
        @DisplayName("train accepts an {\"examples\": [...]} document")
        @SuppressWarnings("unchecked")
        void trainFromWrappedDocument() throws IOException {
            Path file = tempDir.resolve("examples.json");
            Files.writeString(file, """
                    {"examples": [
                      {"message": "make a todo for taxes", "intent": "create_task"},
                      {"message": "book a sync with ana", "intent": "schedule_meeting"}
                    ]}""");
            when(trainingStore.trainOnExamples(anyList())).thenReturn(new TrainingResult(true, 2, List.of()));

            CliResult cli = execute("train", file.toString());

            assertEquals(0, cli.exitCode());
            assertTrue(cli.output().contains("Trained 2 of 2 examples"));
            ArgumentCaptor<List<TrainingExample>> captor = ArgumentCaptor.forClass(List.class);
            verify(trainingStore).trainOnExamples(captor.capture());
            assertEquals("schedule_meeting", captor.getValue().get(1).intent());
        }

        @Test
        @DisplayName("train reports per-example errors and exits 1")
        void trainWithErrors() throws IOException {
            Path file = tempDir.resolve("examples.json");
            Files.writeString(file, "[{\"message\": \"get pizza\", \"intent\": \"order_pizza\"}]");
            when(trainingStore.trainOnExamples(anyList()))
                    .thenReturn(new TrainingResult(false, 0, List.of("Unknown intent: order_pizza")));

            CliResult cli = execute("train", file.toString());

            assertEquals(1, cli.exitCode());
            assertTrue(cli.output().contains("Unknown intent: order_pizza"));
        }

        @Test
        @DisplayName("train exits 2 when the file cannot be read")
        void trainMissingFile() {
            CliResult cli = execute("train", tempDir.resolve("missing.json").toString());

            assertEquals(2, cli.exitCode());
            verify(trainingStore, never()).trainOnExamples(anyList());
        }

        @Test
        @DisplayName("retrain prints the replay count")
        void retrain() {
            when(trainingStore.retrainFromExamples()).thenReturn(new RetrainResult(true, 3));
            when(trainingStore.getTrainingStats()).thenReturn(new TrainingStats(4, Map.of(), null, null));

            CliResult cli = execute("retrain");

            assertEquals(0, cli.exitCode());
            assertTrue(cli.output().contains("Retrained 3 of 4 logged examples"));
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("degraded components warn but exit 0")
        void degraded() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("catalog", HealthStatus.Status.UP, "Intent catalog loaded", Map.of()),
                    new HealthStatus("generative", HealthStatus.Status.DEGRADED,
                            "Generative classification disabled", Map.of())));

            CliResult cli = execute("health");

            assertEquals(0, cli.exitCode());
            assertTrue(cli.output().contains("Generative classification disabled"));
            assertTrue(cli.output().contains("degraded"));
        }

        @Test
        @DisplayName("a DOWN component exits 1")
        void down() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("training", HealthStatus.Status.DOWN,
                            "Training log directory not writable", Map.of())));

            CliResult cli = execute("health");

            assertEquals(1, cli.exitCode());
            assertTrue(cli.output().contains("one or more components down"));
        }
    }

    @Test
    @DisplayName("serve is detected anywhere in the arguments")
    void serveDetection() {
        assertTrue(CliRunner.isServe("serve"));
        assertTrue(CliRunner.isServe("--debug", "serve"));
        assertFalse(CliRunner.isServe("resolve", "serve me a coffee"));
    }
}
