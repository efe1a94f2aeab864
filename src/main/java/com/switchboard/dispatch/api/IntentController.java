package com.switchboard.dispatch.api;

import com.switchboard.core.catalog.CatalogValidationException;
import com.switchboard.core.catalog.IntentCatalog;
import com.switchboard.core.catalog.IntentCatalogLoader;
import com.switchboard.core.engine.IntentEngine;
import com.switchboard.core.model.ResolutionMode;
import com.switchboard.core.training.TrainingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for intent resolution and the intent catalog.
 */
@RestController
@RequestMapping("/api/v1/intents")
public class IntentController {

    private static final Logger log = LoggerFactory.getLogger(IntentController.class);

    private final IntentEngine intentEngine;
    private final IntentCatalog catalog;
    private final IntentCatalogLoader catalogLoader;
    private final TrainingStore trainingStore;

    public IntentController(IntentEngine intentEngine,
                            IntentCatalog catalog,
                            IntentCatalogLoader catalogLoader,
                            TrainingStore trainingStore) {
        this.intentEngine = intentEngine;
        this.catalog = catalog;
        this.catalogLoader = catalogLoader;
        this.trainingStore = trainingStore;
    }

    /**
     * POST /api/v1/intents/resolve: Resolve one message.
     */
    @PostMapping("/resolve")
    public ResponseEntity<?> resolve(@RequestBody ResolveRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Message is required"));
        }
        ResolutionMode mode;
        try {
            mode = ResolutionMode.fromValue(request.mode());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid mode: " + request.mode()));
        }
        var resolution = intentEngine.resolveInContext(request.message(), request.context(), mode);
        return ResponseEntity.ok(new ResolveResponse(resolution.intent(), resolution.context()));
    }

    /**
     * POST /api/v1/intents/conversation: Resolve the latest message of a conversation.
     */
    @PostMapping("/conversation")
    public ResponseEntity<?> conversation(@RequestBody ConversationRequest request) {
        if (request.messages() == null || request.messages().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one message is required"));
        }
        ResolutionMode mode;
        try {
            mode = ResolutionMode.fromValue(request.mode());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid mode: " + request.mode()));
        }
        var resolution = intentEngine.processConversation(request.messages(), request.context(), mode);
        return ResponseEntity.ok(new ResolveResponse(resolution.intent(), resolution.context()));
    }

    /**
     * GET /api/v1/intents: Export the active catalog.
     */
    @GetMapping
    public ResponseEntity<CatalogResponse> export() {
        return ResponseEntity.ok(new CatalogResponse(catalog.snapshot(), catalog.source(), catalog.isDefaulted()));
    }

    /**
     * PUT /api/v1/intents: Replace the catalog with a {@code {"intents":[...]}} document.
     */
    @PutMapping
    public ResponseEntity<?> importCatalog(@RequestBody String body) {
        try {
            var definitions = catalogLoader.parse(body);
            catalog.replaceAll(definitions);
            log.info("Imported {} intents", definitions.size());
            return ResponseEntity.ok(Map.of("imported", definitions.size()));
        } catch (CatalogValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/intents/reload: Re-read the configured catalog and replay training.
     */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        catalog.reload();
        var retrain = trainingStore.retrainFromExamples();
        return ResponseEntity.ok(Map.of(
                "intents", catalog.snapshot().size(),
                "source", catalog.source(),
                "defaulted", catalog.isDefaulted(),
                "retrained", retrain.retrained()));
    }
}
