package com.switchboard.core.catalog;

import com.switchboard.core.config.SwitchboardProperties;
import com.switchboard.core.model.IntentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The active set of intent definitions.
 * <p>
 * Readers take immutable snapshots under the read lock; training and imports
 * swap whole definitions under the write lock, so a reader never observes a
 * partially updated pattern list. Names are unique within the catalog.
 */
@Component
public class IntentCatalog {

    private static final Logger log = LoggerFactory.getLogger(IntentCatalog.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final IntentCatalogLoader loader;
    private final String location;

    private List<IntentDefinition> definitions;
    private String source;
    private boolean defaulted;

    @Autowired
    public IntentCatalog(IntentCatalogLoader loader, SwitchboardProperties properties) {
        this.loader = loader;
        this.location = properties.getCatalogLocation();
        apply(loader.load(location));
    }

    private IntentCatalog(List<IntentDefinition> definitions) {
        this.loader = null;
        this.location = "";
        this.definitions = List.copyOf(definitions);
        this.source = "in-memory";
        this.defaulted = false;
    }

    /**
     * Creates a standalone catalog over the given definitions. {@link #reload()}
     * is not supported on such a catalog.
     */
    public static IntentCatalog of(List<IntentDefinition> definitions) {
        return new IntentCatalog(definitions);
    }

    /** Definitions in declaration order. */
    public List<IntentDefinition> snapshot() {
        lock.readLock().lock();
        try {
            return definitions;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<IntentDefinition> find(String name) {
        return snapshot().stream().filter(d -> d.name().equals(name)).findFirst();
    }

    public boolean isDefaulted() {
        lock.readLock().lock();
        try {
            return defaulted;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String source() {
        lock.readLock().lock();
        try {
            return source;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Teaches {@code message} to the named intent.
     *
     * @return the updated definition, or empty when no intent has that name
     */
    public Optional<IntentDefinition> learn(String intentName, String message) {
        lock.writeLock().lock();
        try {
            for (int i = 0; i < definitions.size(); i++) {
                IntentDefinition current = definitions.get(i);
                if (current.name().equals(intentName)) {
                    IntentDefinition updated = current.withLearnedMessage(message);
                    if (updated != current) {
                        var copy = new ArrayList<>(definitions);
                        copy.set(i, updated);
                        definitions = List.copyOf(copy);
                    }
                    return Optional.of(updated);
                }
            }
            return Optional.empty();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the whole catalog with an imported one.
     *
     * @throws CatalogValidationException when the list is empty or has duplicate names
     */
    public void replaceAll(List<IntentDefinition> imported) {
        List<IntentDefinition> validated = IntentCatalogLoader.validate(imported);
        lock.writeLock().lock();
        try {
            definitions = validated;
            source = "import";
            defaulted = false;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Intent catalog replaced by import ({} intents)", validated.size());
    }

    /**
     * Re-reads the configured catalog file. Learned patterns that exist only in
     * memory are discarded; replay the training log afterwards to restore them.
     */
    public void reload() {
        if (loader == null) {
            throw new IllegalStateException("Catalog has no backing configuration to reload from");
        }
        apply(loader.load(location));
    }

    private void apply(IntentCatalogLoader.LoadedCatalog loaded) {
        lock.writeLock().lock();
        try {
            definitions = loaded.definitions();
            source = loaded.source();
            defaulted = loaded.defaulted();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Intent catalog active: {} intents from {}", loaded.definitions().size(), loaded.source());
    }
}
