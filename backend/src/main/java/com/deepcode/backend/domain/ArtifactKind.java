package com.deepcode.backend.domain;

public enum ArtifactKind {
    UPLOAD,
    CONVERTED
}
