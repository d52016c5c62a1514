package com.agentmesh.core.learning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;

/**
 * Stores each snapshot as {@code <name>.json} in a directory:
 * <pre>
 * { "schemaVersion": 1, "engine": "q-learning",
 *   "tables": { "stateKey": { "action": 0.5 } }, "baselines": { "stateKey": 0.1 } }
 * </pre>
 * Files are written to a temporary sibling first and then moved into place.
 */
public class JsonLearningTableStore implements LearningTableStore {

    private static final Logger log = LoggerFactory.getLogger(JsonLearningTableStore.class);

    public static final int SCHEMA_VERSION = 1;

    record Document(
        int schemaVersion,
        String engine,
        Map<String, Map<String, Double>> tables,
        Map<String, Double> baselines
    ) {}

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonLearningTableStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(String name, LearningSnapshot snapshot) {
        Path target = fileFor(name);
        var document = new Document(SCHEMA_VERSION, snapshot.engine(), snapshot.tables(), snapshot.baselines());
        try {
            Files.createDirectories(directory);
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), document);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved {} table '{}' ({} states)", snapshot.engine(), name, snapshot.tables().size());
        } catch (IOException e) {
            throw new LearningStoreException("Failed to save learning table '" + name + "' to " + target, e);
        }
    }

    /**
     * @throws LearningStoreException if the file is unreadable or has an unknown schema version
     */
    @Override
    public Optional<LearningSnapshot> load(String name) {
        Path source = fileFor(name);
        if (!Files.exists(source)) {
            return Optional.empty();
        }
        Document document;
        try {
            document = objectMapper.readValue(source.toFile(), Document.class);
        } catch (IOException e) {
            throw new LearningStoreException("Failed to read learning table '" + name + "' from " + source, e);
        }
        if (document.schemaVersion() != SCHEMA_VERSION) {
            throw new LearningStoreException("Unsupported learning table schema version "
                    + document.schemaVersion() + " in " + source);
        }
        return Optional.of(new LearningSnapshot(document.engine(), document.tables(), document.baselines()));
    }

    private Path fileFor(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new IllegalArgumentException("Invalid table name: " + name);
        }
        return directory.resolve(name + ".json");
    }
}
