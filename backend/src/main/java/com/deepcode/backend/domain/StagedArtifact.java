package com.deepcode.backend.domain;

import java.nio.file.Path;

public record StagedArtifact(
        Path path,
        ArtifactKind kind,
        String ownerRequestId
) {}
