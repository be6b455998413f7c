package com.harden.core.scanner;

import com.harden.core.config.HardenProperties;
import com.harden.core.model.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks the configured source directory and yields one pending {@link Unit}
 * per file ending with the configured suffix.
 * <p>
 * Files whose stem is excluded, and files under an excluded directory or the
 * sidecar directory, are skipped. Results are sorted by path.
 */
@Service
public class UnitScanner {

    private static final Logger log = LoggerFactory.getLogger(UnitScanner.class);

    private final HardenProperties properties;

    public UnitScanner(HardenProperties properties) {
        this.properties = properties;
    }

    /**
     * Scans the source directory.
     *
     * @return discovered units in path order
     * @throws DiscoveryException if the source directory is missing or cannot be walked
     */
    public List<Unit> scan() {
        Path projectRoot = properties.getProjectRoot();
        Path sourceRoot = properties.getSourceRoot();
        String suffix = properties.getDiscovery().getSuffix();
        Set<String> excludeNames = Set.copyOf(properties.getDiscovery().getExcludeNames());
        Set<String> excludeDirs = withSidecar(properties.getDiscovery().getExcludeDirs(),
                properties.getSidecar().getDirName());
        if (!Files.isDirectory(sourceRoot)) {
            throw new DiscoveryException("Source directory not found: " + sourceRoot);
        }
        try (var stream = Files.walk(sourceRoot)) {
            List<Unit> units = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .filter(p -> !shouldIgnore(sourceRoot, p, excludeNames, excludeDirs))
                    .sorted(Comparator.comparing(Path::toString))
                    .map(p -> toUnit(projectRoot, p))
                    .collect(Collectors.toList());
            log.info("Discovered {} units under {}", units.size(), sourceRoot);
            return units;
        } catch (IOException | UncheckedIOException e) {
            throw new DiscoveryException("Failed to scan " + sourceRoot + ": " + e.getMessage(), e);
        }
    }

    private static boolean shouldIgnore(Path sourceRoot, Path file, Set<String> excludeNames, Set<String> excludeDirs) {
        if (excludeNames.contains(stem(file))) return true;
        Path relativeDir = sourceRoot.relativize(file).getParent();
        if (relativeDir == null) return false;
        for (Path component : relativeDir) {
            if (excludeDirs.contains(component.toString())) return true;
        }
        return false;
    }

    private static Unit toUnit(Path projectRoot, Path file) {
        Path full = file.toAbsolutePath().normalize();
        String relative = full.startsWith(projectRoot) ? projectRoot.relativize(full).toString() : full.toString();
        return Unit.discovered(stem(full), relative, full.toString());
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static Set<String> withSidecar(List<String> excludeDirs, String sidecarDir) {
        var dirs = new HashSet<>(excludeDirs);
        dirs.add(sidecarDir);
        return Set.copyOf(dirs);
    }
}
