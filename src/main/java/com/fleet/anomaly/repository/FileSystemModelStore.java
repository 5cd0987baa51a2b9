package com.fleet.anomaly.repository;

import com.fleet.anomaly.config.DetectionConfig;
import com.fleet.anomaly.model.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores each model as {@code <model-store-path>/<artifact>.json}. Writes go to a temporary
 * file first and are moved into place, so a reader never sees a half-written artifact.
 */
@Repository
public class FileSystemModelStore implements ModelStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemModelStore.class);

    private final Path directory;

    @Autowired
    public FileSystemModelStore(DetectionConfig config) {
        this(Paths.get(config.getModelStorePath()));
    }

    public FileSystemModelStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public void save(MessageType messageType, byte[] artifact) throws IOException {
        Files.createDirectories(directory);
        Path target = pathFor(messageType);
        Path tmp = Files.createTempFile(directory, messageType.getArtifactName(), ".tmp");
        try {
            Files.write(tmp, artifact);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Wrote {} bytes to {}", artifact.length, target);
    }

    @Override
    public Optional<byte[]> load(MessageType messageType) throws IOException {
        Path path = pathFor(messageType);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(path));
    }

    Path pathFor(MessageType messageType) {
        return directory.resolve(messageType.getArtifactName() + ".json");
    }
}
