package com.switchboard.core.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.model.IntentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Reads intent definitions from a {@code {"intents":[...]}} JSON document.
 * <p>
 * {@link #load(String)} never fails: any problem with the configured file is
 * logged and the built-in {@link DefaultIntentCatalog} is returned, flagged as
 * {@code defaulted}. {@link #parse(String)} is the strict variant used for
 * imports and throws {@link CatalogValidationException}.
 */
@Component
public class IntentCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(IntentCatalogLoader.class);

    private final ObjectMapper objectMapper;

    public IntentCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Outcome of a load: the definitions plus where they came from.
     *
     * @param defaulted true when a catalog file was configured but could not be used
     */
    public record LoadedCatalog(List<IntentDefinition> definitions, String source, boolean defaulted) {

        public LoadedCatalog {
            definitions = List.copyOf(definitions);
        }

        static LoadedCatalog builtIn() {
            return new LoadedCatalog(DefaultIntentCatalog.definitions(), "built-in", false);
        }

        static LoadedCatalog fallback(String location) {
            return new LoadedCatalog(DefaultIntentCatalog.definitions(), "built-in (fallback for " + location + ")", true);
        }
    }

    public LoadedCatalog load(String location) {
        if (location == null || location.isBlank()) {
            log.info("No intent catalog configured, using {} built-in intents", DefaultIntentCatalog.definitions().size());
            return LoadedCatalog.builtIn();
        }
        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            log.warn("Intent catalog {} not found, using built-in intents", path);
            return LoadedCatalog.fallback(location);
        }
        try {
            List<IntentDefinition> definitions = parse(Files.readString(path));
            log.info("Loaded {} intents from {}", definitions.size(), path);
            return new LoadedCatalog(definitions, path.toString(), false);
        } catch (IOException | CatalogValidationException e) {
            log.warn("Failed to load intent catalog from {}, using built-in intents: {}", path, e.getMessage());
            return LoadedCatalog.fallback(location);
        }
    }

    /**
     * Strictly parses and validates a catalog document.
     *
     * @throws CatalogValidationException on malformed JSON, a missing or empty
     *                                    {@code intents} array, invalid entries or duplicate names
     */
    public List<IntentDefinition> parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new CatalogValidationException("Catalog is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.path("intents").isArray()) {
            throw new CatalogValidationException("Catalog must contain an \"intents\" array");
        }
        var definitions = new ArrayList<IntentDefinition>();
        for (JsonNode node : root.get("intents")) {
            if (node == null || !node.isObject()) {
                throw new CatalogValidationException("Invalid intent definition: expected an object but got "
                        + (node == null ? "null" : node.getNodeType()));
            }
            try {
                definitions.add(objectMapper.treeToValue(node, IntentDefinition.class));
            } catch (IOException | IllegalArgumentException e) {
                throw new CatalogValidationException("Invalid intent definition: " + e.getMessage(), e);
            }
        }
        return validate(definitions);
    }

    /**
     * Checks that the list is non-empty, has no null entries and intent names are unique.
     */
    public static List<IntentDefinition> validate(List<IntentDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new CatalogValidationException("Catalog contains no intents");
        }
        var seen = new HashSet<String>();
        for (IntentDefinition definition : definitions) {
            if (definition == null) {
                throw new CatalogValidationException("Catalog contains a null intent definition");
            }
            if (!seen.add(definition.name())) {
                throw new CatalogValidationException("Duplicate intent name: " + definition.name());
            }
        }
        return List.copyOf(definitions);
    }
}
