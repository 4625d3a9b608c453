package com.deepcode.backend.service.storage;

import com.deepcode.backend.config.DeepCodeProperties;
import com.deepcode.backend.domain.ArtifactKind;
import com.deepcode.backend.domain.StagedArtifact;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.InputStreamSource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Temporary files for in-flight requests. Names are {@code <uuid>.<ext>} under the scratch directory,
 * so concurrent uploads never collide and the original extension survives for format detection.
 */
@Component
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private final Path scratchDir;
    private final boolean purgeOrphans;

    @Autowired
    public ArtifactStore(DeepCodeProperties props) {
        this(props.storage().scratchDir(), props.storage().purgeOrphansOnStartup());
    }

    public ArtifactStore(Path scratchDir, boolean purgeOrphans) {
        this.scratchDir = scratchDir.toAbsolutePath();
        this.purgeOrphans = purgeOrphans;
    }

    public Path scratchDir() {
        return scratchDir;
    }

    public ArtifactScope openScope(String requestId) {
        return new ArtifactScope(this, requestId);
    }

    /**
     * Copies the upload into a fresh scratch file.
     *
     * @throws ScratchDirectoryUnavailableException if the scratch directory cannot be created
     * @throws IOException if reading the upload or writing the copy fails; the partial copy is removed
     */
    public StagedArtifact stage(InputStreamSource source, String originalFilename, String requestId) throws IOException {
        try {
            Files.createDirectories(scratchDir);
        } catch (IOException e) {
            throw new ScratchDirectoryUnavailableException("Scratch directory " + scratchDir + " is unavailable", e);
        }
        Path target = scratchDir.resolve(UUID.randomUUID() + extensionSuffix(originalFilename));

        try (InputStream in = source.getInputStream()) {
            Files.copy(in, target);
        } catch (IOException | RuntimeException e) {
            release(target);
            throw e;
        }
        log.debug("Staged {} as {}", originalFilename, target.getFileName());
        return new StagedArtifact(target, ArtifactKind.UPLOAD, requestId);
    }

    /**
     * Deletes the artifact. A path that is already gone counts as released.
     *
     * @return false only when the file exists and could not be deleted
     */
    public boolean release(Path path) {
        if (path == null) return true;
        try {
            Files.deleteIfExists(path);
            return true;
        } catch (IOException e) {
            log.warn("Failed to release artifact {}: {}", path, e.getMessage());
            return false;
        }
    }

    /** Files currently present in the scratch directory. */
    public List<Path> listArtifacts() throws IOException {
        if (!Files.isDirectory(scratchDir)) return List.of();
        try (Stream<Path> s = Files.list(scratchDir)) {
            return s.filter(Files::isRegularFile).collect(Collectors.toList());
        }
    }

    @PostConstruct
    void checkOrphans() {
        try {
            List<Path> orphans = listArtifacts();
            if (orphans.isEmpty()) return;
            if (purgeOrphans) {
                long removed = orphans.stream().filter(this::release).count();
                log.info("Removed {} orphaned artifact(s) from {}", removed, scratchDir);
            } else {
                log.info("Found {} orphaned artifact(s) in {}", orphans.size(), scratchDir);
            }
        } catch (IOException e) {
            log.warn("Could not inspect scratch directory {}: {}", scratchDir, e.getMessage());
        }
    }

    /** Lower-cased ".ext" from the last path segment of the name, or "" when there is none. */
    static String extensionSuffix(String filename) {
        String ext = extensionOf(filename);
        return ext.isEmpty() ? "" : "." + ext;
    }

    public static String extensionOf(String filename) {
        if (filename == null) return "";
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) return "";
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return ext.chars().allMatch(Character::isLetterOrDigit) ? ext : "";
    }
}
