package com.deepcode.backend.service.conversion;

import com.deepcode.backend.service.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Best-effort PDF conversion. Never fails the request: any problem yields an empty result and the
 * caller keeps using the original file.
 */
@Service
public class ConversionAdapter {

    private static final Logger log = LoggerFactory.getLogger(ConversionAdapter.class);
    private static final String TARGET_EXTENSION = "pdf";

    private final DocumentConverter converter;

    public ConversionAdapter(DocumentConverter converter) {
        this.converter = converter;
    }

    public boolean needsConversion(Path path) {
        String ext = ArtifactStore.extensionOf(path.getFileName().toString());
        return !ext.isEmpty() && !TARGET_EXTENSION.equals(ext);
    }

    public boolean isConverterAvailable() {
        try {
            return converter.isAvailable();
        } catch (RuntimeException e) {
            log.warn("Document converter availability check failed: {}", e.getMessage());
            return false;
        }
    }

    public Optional<Path> convertIfNeeded(Path path) {
        if (!needsConversion(path)) {
            return Optional.empty();
        }
        if (!isConverterAvailable()) {
            log.warn("Document converter unavailable, processing {} as-is", path.getFileName());
            return Optional.empty();
        }
        try {
            Path converted = converter.convertToPdf(path);
            if (converted == null || !Files.exists(converted)) {
                log.warn("Conversion of {} reported no output, processing original", path.getFileName());
                return Optional.empty();
            }
            return Optional.of(converted);
        } catch (ConversionException | RuntimeException e) {
            log.warn("Conversion of {} failed, processing original: {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }
}
