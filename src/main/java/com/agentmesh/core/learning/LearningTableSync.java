package com.agentmesh.core.learning;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Keeps one engine's tables in a {@link LearningTableStore} across restarts: restores them when
 * the context starts and saves them when it closes. A store failure costs the learned tables,
 * not the application, so it is logged and the engine carries on with what it has.
 */
public class LearningTableSync {

    private static final Logger log = LoggerFactory.getLogger(LearningTableSync.class);

    private final LearningTableStore store;
    private final String name;
    private final Supplier<LearningSnapshot> snapshot;
    private final Consumer<LearningSnapshot> restore;

    public LearningTableSync(LearningTableStore store, String name,
                             Supplier<LearningSnapshot> snapshot, Consumer<LearningSnapshot> restore) {
        this.store = store;
        this.name = name;
        this.snapshot = snapshot;
        this.restore = restore;
    }

    public static LearningTableSync of(LearningTableStore store, String name, QLearningEngine engine) {
        return new LearningTableSync(store, name, engine::snapshot, engine::restore);
    }

    public static LearningTableSync of(LearningTableStore store, String name, PolicyGradientEngine engine) {
        return new LearningTableSync(store, name, engine::snapshot, engine::restore);
    }

    @PostConstruct
    void onStart() {
        restoreTables();
    }

    @PreDestroy
    void onStop() {
        saveTables();
    }

    /**
     * @return true if saved tables were found and loaded
     */
    public boolean restoreTables() {
        try {
            var saved = store.load(name);
            if (saved.isEmpty()) {
                log.info("No saved learning tables for {}, starting fresh", name);
                return false;
            }
            restore.accept(saved.get());
            return true;
        } catch (LearningStoreException e) {
            log.warn("Could not restore learning tables for {}: {}", name, e.getMessage());
            return false;
        }
    }

    /**
     * @return true if the tables were written
     */
    public boolean saveTables() {
        try {
            store.save(name, snapshot.get());
            log.info("Saved learning tables for {}", name);
            return true;
        } catch (LearningStoreException e) {
            log.warn("Could not save learning tables for {}: {}", name, e.getMessage());
            return false;
        }
    }

    public String name() {
        return name;
    }
}
