package com.deepcode.backend.service.conversion;

import java.nio.file.Path;

/**
 * Turns a document into a PDF next to it.
 */
public interface DocumentConverter {

    boolean isAvailable();

    Path convertToPdf(Path source) throws ConversionException;
}
