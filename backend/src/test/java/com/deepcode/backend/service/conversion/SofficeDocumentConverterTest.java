package com.deepcode.backend.service.conversion;

import com.deepcode.backend.config.DeepCodeProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SofficeDocumentConverterTest {

    @TempDir
    Path dir;

    private static DeepCodeProperties props(boolean enabled, String command, Duration timeout) {
        return new DeepCodeProperties(
                new DeepCodeProperties.Storage(Path.of("scratch"), Path.of("history.json"), false),
                new DeepCodeProperties.Engine("", Duration.ofSeconds(1), Duration.ofSeconds(1), 1),
                new DeepCodeProperties.Conversion(enabled, command, timeout),
                new DeepCodeProperties.Progress("/ws/progress", List.of("*"), Duration.ofSeconds(1), 1024));
    }

    private Path script(String name, String body) throws Exception {
        Path p = dir.resolve(name);
        Files.writeString(p, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(p, PosixFilePermissions.fromString("rwxr-xr-x"));
        return p;
    }

    @Test
    void unknownCommandIsUnavailable() {
        SofficeDocumentConverter c = new SofficeDocumentConverter(
                props(true, "definitely-not-a-real-office-binary-42", Duration.ofSeconds(5)));
        assertFalse(c.isAvailable());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void disabledConverterIsUnavailableEvenWhenCommandExists() throws Exception {
        Path fake = script("soffice", "exit 0");
        assertTrue(new SofficeDocumentConverter(props(true, fake.toString(), Duration.ofSeconds(5))).isAvailable());
        assertFalse(new SofficeDocumentConverter(props(false, fake.toString(), Duration.ofSeconds(5))).isAvailable());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void convertsNextToTheSource() throws Exception {
        // args: -env:UserInstallation=<uri> --headless --convert-to pdf --outdir <dir> <file>
        Path fake = script("soffice",
                "base=$(basename \"$7\"); echo converted > \"$6/${base%.*}.pdf\"");
        Path source = Files.writeString(dir.resolve("abc.docx"), "doc");

        Path pdf = new SofficeDocumentConverter(props(true, fake.toString(), Duration.ofSeconds(20)))
                .convertToPdf(source);

        assertEquals(dir.resolve("abc.pdf").toAbsolutePath(), pdf);
        assertTrue(Files.exists(pdf));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void nonZeroExitFailsAndRemovesPartialOutput() throws Exception {
        Path fake = script("soffice",
                "base=$(basename \"$7\"); echo partial > \"$6/${base%.*}.pdf\"; exit 3");
        Path source = Files.writeString(dir.resolve("half.odt"), "doc");

        SofficeDocumentConverter c = new SofficeDocumentConverter(props(true, fake.toString(), Duration.ofSeconds(20)));
        ConversionException e = assertThrows(ConversionException.class, () -> c.convertToPdf(source));

        assertTrue(e.getMessage().contains("code 3"), e.getMessage());
        assertFalse(Files.exists(dir.resolve("half.pdf")));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void everyConversionGetsItsOwnProfileWhichIsRemovedAfterwards() throws Exception {
        Path calls = dir.resolve("calls.log");
        Path fake = script("soffice",
                "profile=${1#-env:UserInstallation=file://}; [ -d \"$profile\" ] || exit 9; "
                        + "echo \"$1\" >> \"" + calls + "\"; "
                        + "base=$(basename \"$7\"); echo converted > \"$6/${base%.*}.pdf\"");
        SofficeDocumentConverter c = new SofficeDocumentConverter(props(true, fake.toString(), Duration.ofSeconds(20)));

        c.convertToPdf(Files.writeString(dir.resolve("one.docx"), "doc"));
        c.convertToPdf(Files.writeString(dir.resolve("two.docx"), "doc"));

        List<String> profiles = Files.readAllLines(calls);
        assertEquals(2, profiles.size());
        assertNotEquals(profiles.get(0), profiles.get(1));
        for (String arg : profiles) {
            assertTrue(arg.startsWith("-env:UserInstallation=file:"), arg);
            Path profile = Path.of(URI.create(arg.substring("-env:UserInstallation=".length())));
            assertFalse(Files.exists(profile), profile + " was left behind");
        }
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void missingOutputFails() throws Exception {
        Path fake = script("soffice", "exit 0");
        Path source = Files.writeString(dir.resolve("x.txt"), "text");

        SofficeDocumentConverter c = new SofficeDocumentConverter(props(true, fake.toString(), Duration.ofSeconds(20)));
        assertThrows(ConversionException.class, () -> c.convertToPdf(source));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void slowConversionTimesOut() throws Exception {
        Path fake = script("soffice", "sleep 10");
        Path source = Files.writeString(dir.resolve("slow.txt"), "text");

        SofficeDocumentConverter c = new SofficeDocumentConverter(props(true, fake.toString(), Duration.ofMillis(300)));
        ConversionException e = assertThrows(ConversionException.class, () -> c.convertToPdf(source));
        assertTrue(e.getMessage().contains("timed out"), e.getMessage());
    }

    @Test
    void stripExtension() {
        assertEquals("abc", SofficeDocumentConverter.stripExtension("abc.docx"));
        assertEquals("abc", SofficeDocumentConverter.stripExtension("abc"));
        assertEquals(".hidden", SofficeDocumentConverter.stripExtension(".hidden"));
    }
}
