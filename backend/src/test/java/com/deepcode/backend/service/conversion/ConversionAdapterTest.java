package com.deepcode.backend.service.conversion;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConversionAdapterTest {

    @TempDir
    Path dir;

    @Test
    void pdfAndExtensionlessFilesAreNotConverted() throws Exception {
        DocumentConverter converter = mock(DocumentConverter.class);
        ConversionAdapter adapter = new ConversionAdapter(converter);

        assertEquals(Optional.empty(), adapter.convertIfNeeded(dir.resolve("paper.pdf")));
        assertEquals(Optional.empty(), adapter.convertIfNeeded(dir.resolve("README")));
        verify(converter, never()).convertToPdf(any());
    }

    @Test
    void successfulConversionReturnsTheDerivedPath() throws Exception {
        Path source = Files.writeString(dir.resolve("a.docx"), "doc");
        Path pdf = Files.writeString(dir.resolve("a.pdf"), "pdf");
        DocumentConverter converter = mock(DocumentConverter.class);
        when(converter.isAvailable()).thenReturn(true);
        when(converter.convertToPdf(source)).thenReturn(pdf);

        assertEquals(Optional.of(pdf), new ConversionAdapter(converter).convertIfNeeded(source));
    }

    @Test
    void unavailableConverterFallsBack() throws Exception {
        DocumentConverter converter = mock(DocumentConverter.class);
        when(converter.isAvailable()).thenReturn(false);

        assertTrue(new ConversionAdapter(converter).convertIfNeeded(dir.resolve("a.txt")).isEmpty());
        verify(converter, never()).convertToPdf(any());
    }

    @Test
    void conversionFailuresFallBack() throws Exception {
        Path source = dir.resolve("a.pptx");
        DocumentConverter failing = mock(DocumentConverter.class);
        when(failing.isAvailable()).thenReturn(true);
        when(failing.convertToPdf(source)).thenThrow(new ConversionException("soffice exited with code 1"));

        DocumentConverter exploding = mock(DocumentConverter.class);
        when(exploding.isAvailable()).thenReturn(true);
        when(exploding.convertToPdf(source)).thenThrow(new IllegalStateException("bug"));

        DocumentConverter noOutput = mock(DocumentConverter.class);
        when(noOutput.isAvailable()).thenReturn(true);
        when(noOutput.convertToPdf(source)).thenReturn(dir.resolve("missing.pdf"));

        assertTrue(new ConversionAdapter(failing).convertIfNeeded(source).isEmpty());
        assertTrue(new ConversionAdapter(exploding).convertIfNeeded(source).isEmpty());
        assertTrue(new ConversionAdapter(noOutput).convertIfNeeded(source).isEmpty());
    }

    @Test
    void availabilityCheckFailureCountsAsUnavailable() {
        DocumentConverter converter = mock(DocumentConverter.class);
        when(converter.isAvailable()).thenThrow(new SecurityException("no exec"));

        ConversionAdapter adapter = new ConversionAdapter(converter);
        assertFalse(adapter.isConverterAvailable());
        assertTrue(adapter.convertIfNeeded(dir.resolve("a.txt")).isEmpty());
    }
}
