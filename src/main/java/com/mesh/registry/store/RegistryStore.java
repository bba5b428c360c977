package com.mesh.registry.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mesh.registry.config.AppProperties;
import com.mesh.registry.exception.InvalidVersionFormatException;
import com.mesh.registry.exception.RegistryCommitFailedException;
import com.mesh.registry.exception.RegistryCorruptException;
import com.mesh.registry.model.Registry;
import com.mesh.registry.model.SemanticVersion;
import com.mesh.registry.model.VersionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Durable home of the {@link Registry} document.
 *
 * <p>{@link #commit(Registry)} never writes in place: the document goes to a temp
 * file that is renamed over the previous one, so {@link #load()} sees either the
 * old or the new document in full. Callers that mutate must hold the
 * {@link RegistryLock} across load and commit.
 */
@Slf4j
@Component
public class RegistryStore {

    private final Path registryPath;
    private final ObjectMapper mapper;
    private final Clock clock;

    @Autowired
    public RegistryStore(AppProperties props, ObjectMapper mapper, Clock clock) {
        this(props.getRegistry().registryPath(), mapper, clock);
    }

    public RegistryStore(Path registryPath, ObjectMapper mapper, Clock clock) {
        this.registryPath = registryPath;
        this.mapper = mapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }

    public Path location() {
        return registryPath;
    }

    /**
     * Names that would collide with the registry document or its lock file when
     * used as a model directory beside them.
     */
    public boolean isReservedName(String name) {
        String documentName = registryPath.getFileName().toString();
        return documentName.equalsIgnoreCase(name) || (documentName + ".lock").equalsIgnoreCase(name);
    }

    public Registry load() {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(registryPath);
        } catch (NoSuchFileException e) {
            return new Registry();
        } catch (IOException e) {
            throw corrupt("Failed to read registry " + registryPath, e);
        }

        Registry registry;
        try {
            registry = mapper.readValue(bytes, Registry.class);
        } catch (IOException e) {
            throw corrupt("Malformed registry document " + registryPath + ": " + e.getMessage(), e);
        }
        if (registry == null) {
            throw corrupt("Registry document " + registryPath + " is empty", null);
        }
        validate(registry);
        registry.syncProductionFlags();
        return registry;
    }

    public void commit(Registry registry) {
        registry.setLastUpdated(clock.instant());
        registry.syncProductionFlags();

        Path tmp = null;
        try {
            byte[] bytes = mapper.writeValueAsBytes(registry);
            tmp = AtomicFiles.writeTemp(registryPath, bytes);
            moveIntoPlace(tmp, registryPath);
            tmp = null;
        } catch (IOException e) {
            throw new RegistryCommitFailedException("Failed to commit registry " + registryPath, e);
        } finally {
            if (tmp != null) {
                discardTemp(tmp);
            }
        }
        log.debug("Registry committed to {}", registryPath);
    }

    /** Final step of a commit; the previous document is intact until this returns. */
    protected void moveIntoPlace(Path tmp, Path target) throws IOException {
        AtomicFiles.moveIntoPlace(tmp, target);
    }

    private void discardTemp(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp registry file {}", tmp, e);
        }
    }

    private void validate(Registry registry) {
        if (registry.getModels() == null || registry.getCurrentProduction() == null) {
            throw corrupt("Registry document " + registryPath + " is missing 'models' or 'currentProduction'", null);
        }
        for (Map.Entry<String, List<VersionRecord>> entry : registry.getModels().entrySet()) {
            String modelName = entry.getKey();
            List<VersionRecord> line = entry.getValue();
            if (line == null) {
                throw corrupt("Model " + modelName + " has no version list", null);
            }
            SemanticVersion previous = null;
            for (VersionRecord r : line) {
                if (r == null || !modelName.equals(r.getModelName())) {
                    throw corrupt("Model " + modelName + " contains a record of another model", null);
                }
                SemanticVersion current;
                try {
                    current = r.semanticVersion();
                } catch (InvalidVersionFormatException e) {
                    throw corrupt("Model " + modelName + ": " + e.getMessage(), e);
                }
                if (previous != null && current.compareTo(previous) <= 0) {
                    throw corrupt("Model " + modelName + ": version " + current
                            + " does not follow " + previous, null);
                }
                previous = current;
            }
        }
        for (Map.Entry<String, String> pointer : registry.getCurrentProduction().entrySet()) {
            List<VersionRecord> line = registry.getModels().get(pointer.getKey());
            boolean present = line != null && line.stream().anyMatch(r -> r.getVersion().equals(pointer.getValue()));
            if (!present) {
                throw corrupt("Production pointer " + pointer.getKey() + " -> " + pointer.getValue()
                        + " names a version that is not registered", null);
            }
        }
    }

    private RegistryCorruptException corrupt(String message, Throwable cause) {
        log.error(message);
        return cause == null ? new RegistryCorruptException(message) : new RegistryCorruptException(message, cause);
    }
}
