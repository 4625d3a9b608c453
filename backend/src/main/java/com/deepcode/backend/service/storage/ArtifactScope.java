package com.deepcode.backend.service.storage;

import com.deepcode.backend.domain.ArtifactKind;
import com.deepcode.backend.domain.StagedArtifact;
import org.springframework.core.io.InputStreamSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Every artifact a single request stages or derives. Closing the scope releases all of them.
 * Not thread-safe; one scope belongs to one request.
 */
public class ArtifactScope implements AutoCloseable {

    private final ArtifactStore store;
    private final String requestId;
    private final List<StagedArtifact> artifacts = new ArrayList<>();

    ArtifactScope(ArtifactStore store, String requestId) {
        this.store = store;
        this.requestId = requestId;
    }

    public StagedArtifact stage(InputStreamSource source, String originalFilename) throws IOException {
        StagedArtifact a = store.stage(source, originalFilename, requestId);
        artifacts.add(a);
        return a;
    }

    /** Tracks a file derived from a staged upload (e.g. a converted PDF). */
    public StagedArtifact adopt(Path path, ArtifactKind kind) {
        StagedArtifact a = new StagedArtifact(path, kind, requestId);
        artifacts.add(a);
        return a;
    }

    public List<StagedArtifact> artifacts() {
        return Collections.unmodifiableList(artifacts);
    }

    @Override
    public void close() {
        // derived files first, then the upload they came from
        for (int i = artifacts.size() - 1; i >= 0; i--) {
            store.release(artifacts.get(i).path());
        }
        artifacts.clear();
    }
}
