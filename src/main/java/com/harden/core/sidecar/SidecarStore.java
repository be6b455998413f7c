package com.harden.core.sidecar;

import com.harden.core.config.HardenProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists per-unit phase artifacts next to the unit they describe.
 * <p>
 * Artifacts for {@code app/controllers/users_controller.rb} live in
 * {@code app/controllers/.harden/users_controller/}. Writes that would land
 * outside the project root are refused.
 */
@Component
public class SidecarStore {

    private static final Logger log = LoggerFactory.getLogger(SidecarStore.class);

    private final HardenProperties properties;

    public SidecarStore(HardenProperties properties) {
        this.properties = properties;
    }

    /**
     * Writes one artifact, creating the sidecar directory when needed.
     * A trailing newline is appended unless the content already ends with one.
     *
     * @return the path written
     * @throws SidecarException if the target escapes the project root or the write fails
     */
    public Path write(Path unitFullPath, String artifactName, String content) {
        return writeVerbatim(unitFullPath, artifactName, content.endsWith("\n") ? content : content + "\n");
    }

    /**
     * Writes one artifact exactly as given.
     */
    public Path writeVerbatim(Path unitFullPath, String artifactName, String content) {
        Path target = resolve(unitFullPath, artifactName);
        if (!target.startsWith(properties.getProjectRoot())) {
            throw new SidecarException("Refusing to write outside project root: " + target);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SidecarException("Failed to write " + target + ": " + e.getMessage(), e);
        }
        log.debug("Wrote sidecar artifact {}", target);
        return target;
    }

    /**
     * Reads one artifact.
     *
     * @return the artifact text, or empty when it was never written
     */
    public Optional<String> read(Path unitFullPath, String artifactName) {
        Path target = resolve(unitFullPath, artifactName);
        if (!target.startsWith(properties.getProjectRoot())) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new SidecarException("Failed to read " + target + ": " + e.getMessage(), e);
        }
    }

    /** Sidecar directory for a unit. */
    public Path directoryFor(Path unitFullPath) {
        Path unit = unitFullPath.toAbsolutePath().normalize();
        Path parent = unit.getParent() != null ? unit.getParent() : properties.getProjectRoot();
        return parent.resolve(properties.getSidecar().getDirName()).resolve(stem(unit));
    }

    private Path resolve(Path unitFullPath, String artifactName) {
        if (artifactName == null || artifactName.isBlank()) {
            throw new IllegalArgumentException("Artifact name must not be blank");
        }
        return directoryFor(unitFullPath).resolve(artifactName).normalize();
    }

    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
