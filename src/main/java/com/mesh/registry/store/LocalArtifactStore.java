package com.mesh.registry.store;

import com.mesh.registry.config.AppProperties;
import com.mesh.registry.exception.ArtifactDeleteFailedException;
import com.mesh.registry.exception.ArtifactReadFailedException;
import com.mesh.registry.exception.ArtifactWriteFailedException;
import com.mesh.registry.util.ArtifactKeyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Artifacts on the local file system: {@code <baseDir>/<model>/<version>/<file>}.
 * Locators are paths relative to the base directory.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.registry", name = "artifact-backend", havingValue = "local", matchIfMissing = true)
public class LocalArtifactStore implements ArtifactStore {

    private final Path baseDir;
    private final String artifactFileName;
    private final String metadataFileName;

    @Autowired
    public LocalArtifactStore(AppProperties props) {
        this(props.getRegistry().baseDirPath(),
                props.getRegistry().getArtifactFileName(),
                props.getRegistry().getMetadataFileName());
    }

    public LocalArtifactStore(Path baseDir, String artifactFileName, String metadataFileName) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.artifactFileName = ArtifactKeyUtil.requireSafeSegment(artifactFileName, "artifact file name");
        this.metadataFileName = ArtifactKeyUtil.requireSafeSegment(metadataFileName, "metadata file name");
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public String artifactLocator(String modelName, String version) {
        return ArtifactKeyUtil.join(ArtifactKeyUtil.versionPrefix(modelName, version), artifactFileName);
    }

    @Override
    public String metadataLocator(String modelName, String version) {
        return ArtifactKeyUtil.join(ArtifactKeyUtil.versionPrefix(modelName, version), metadataFileName);
    }

    @Override
    public void write(String locator, byte[] bytes) {
        Path target = resolve(locator);
        try {
            AtomicFiles.write(target, bytes);
        } catch (IOException e) {
            throw new ArtifactWriteFailedException("Failed to write artifact " + target, e);
        }
        log.debug("Wrote {} bytes to {}", bytes.length, target);
    }

    @Override
    public byte[] read(String locator) {
        Path source = resolve(locator);
        try {
            return Files.readAllBytes(source);
        } catch (NoSuchFileException e) {
            throw new ArtifactReadFailedException("Artifact not found: " + source, e);
        } catch (IOException e) {
            throw new ArtifactReadFailedException("Failed to read artifact " + source, e);
        }
    }

    @Override
    public boolean exists(String locator) {
        return Files.isRegularFile(resolve(locator));
    }

    @Override
    public void deleteVersion(String modelName, String version) {
        Path versionDir = resolve(ArtifactKeyUtil.versionPrefix(modelName, version));
        if (!Files.exists(versionDir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(versionDir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new ArtifactDeleteFailedException("Failed to delete " + versionDir, e);
        }
        log.debug("Deleted artifact directory {}", versionDir);
    }

    private Path resolve(String locator) {
        Path resolved = baseDir.resolve(locator).normalize();
        if (!resolved.startsWith(baseDir) || resolved.equals(baseDir)) {
            throw new IllegalArgumentException("Locator escapes the artifact directory: " + locator);
        }
        return resolved;
    }
}
