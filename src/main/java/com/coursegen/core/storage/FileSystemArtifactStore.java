package com.coursegen.core.storage;

import com.coursegen.core.config.CoursegenProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link ArtifactStore} rooted at a local directory.
 * Writes go to a temp file first and are moved into place, so readers never see a torn file.
 */
@Component
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    private final Path root;

    @Autowired
    public FileSystemArtifactStore(CoursegenProperties properties) {
        this(Path.of(properties.getStorage().getRoot()));
    }

    public FileSystemArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        log.info("Artifact store rooted at {}", this.root);
    }

    @Override
    public void put(String key, byte[] content) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".put-", ".tmp");
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored {} ({} bytes)", key, content.length);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to write " + key, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return Optional.of(Files.readAllBytes(resolve(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    private Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Key escapes the store root: " + key);
        }
        return path;
    }
}
