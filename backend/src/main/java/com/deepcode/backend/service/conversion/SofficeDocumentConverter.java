package com.deepcode.backend.service.conversion;

import com.deepcode.backend.config.DeepCodeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Headless LibreOffice: {@code soffice -env:UserInstallation=<profile> --headless --convert-to pdf --outdir <dir> <file>}.
 *
 * <p>Every call gets its own throwaway user profile; LibreOffice locks its profile, so concurrent
 * conversions sharing one would fail or block each other.
 */
@Component
public class SofficeDocumentConverter implements DocumentConverter {

    private static final Logger log = LoggerFactory.getLogger(SofficeDocumentConverter.class);

    private final boolean enabled;
    private final String command;
    private final Duration timeout;

    public SofficeDocumentConverter(DeepCodeProperties props) {
        DeepCodeProperties.Conversion c = props.conversion();
        this.enabled = c.enabled();
        this.command = c.command();
        this.timeout = c.timeout();
    }

    @Override
    public boolean isAvailable() {
        return enabled && command != null && !command.isBlank() && resolveExecutable(command) != null;
    }

    @Override
    public Path convertToPdf(Path source) throws ConversionException {
        Path outDir = source.toAbsolutePath().getParent();
        Path target = outDir.resolve(stripExtension(source.getFileName().toString()) + ".pdf");

        Path profile;
        try {
            profile = Files.createTempDirectory("soffice-profile-");
        } catch (IOException e) {
            throw new ConversionException("could not create a LibreOffice profile directory", e);
        }
        try {
            run(source, outDir, target, profile);
            return target;
        } catch (ConversionException e) {
            discardPartialOutput(target);
            throw e;
        } finally {
            discardProfile(profile);
        }
    }

    private void run(Path source, Path outDir, Path target, Path profile) throws ConversionException {
        List<String> cmd = List.of(command, "-env:UserInstallation=" + profile.toUri(), "--headless",
                "--convert-to", "pdf", "--outdir", outDir.toString(), source.toAbsolutePath().toString());
        Process proc;
        try {
            proc = new ProcessBuilder(cmd)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new ConversionException("could not start " + command, e);
        }

        try {
            if (!proc.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                proc.destroyForcibly();
                throw new ConversionException("conversion timed out after " + timeout.toSeconds() + "s");
            }
        } catch (InterruptedException e) {
            proc.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ConversionException("conversion interrupted", e);
        }

        if (proc.exitValue() != 0) {
            throw new ConversionException(command + " exited with code " + proc.exitValue());
        }
        if (!Files.exists(target)) {
            throw new ConversionException("converter produced no output for " + source.getFileName());
        }
        log.debug("Converted {} -> {}", source.getFileName(), target.getFileName());
    }

    private static void discardPartialOutput(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Could not remove partial conversion output {}: {}", target, e.getMessage());
        }
    }

    private static void discardProfile(Path profile) {
        try {
            FileSystemUtils.deleteRecursively(profile);
        } catch (IOException e) {
            log.warn("Could not remove LibreOffice profile {}: {}", profile, e.getMessage());
        }
    }

    static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static Path resolveExecutable(String command) {
        Path direct = Paths.get(command);
        if (direct.isAbsolute()) {
            return Files.isExecutable(direct) ? direct : null;
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) return null;
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Paths.get(dir, command);
            if (Files.isExecutable(candidate)) return candidate;
            Path exe = Paths.get(dir, command + ".exe");
            if (Files.isExecutable(exe)) return exe;
        }
        return null;
    }
}
