package com.mesh.registry.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mesh.registry.dto.ModelRegistration;
import com.mesh.registry.exception.ArtifactDeleteFailedException;
import com.mesh.registry.exception.ArtifactWriteFailedException;
import com.mesh.registry.exception.InvalidLifecycleTransitionException;
import com.mesh.registry.model.BumpKind;
import com.mesh.registry.model.Registry;
import com.mesh.registry.model.VersionRecord;
import com.mesh.registry.model.VersionStatus;
import com.mesh.registry.store.ArtifactStore;
import com.mesh.registry.store.RegistryLock;
import com.mesh.registry.store.RegistryStore;
import com.mesh.registry.util.ArtifactKeyUtil;
import com.mesh.registry.util.Checksums;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registers new versions and moves existing ones through their lifecycle.
 * This is the only writer of the production pointer.
 *
 * <p>Every operation runs load, modify and commit while holding the
 * {@link RegistryLock}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionManager {

    private final RegistryStore registryStore;
    private final RegistryLock registryLock;
    private final ArtifactStore artifactStore;
    private final VersionAllocator versionAllocator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Stores the artifact and appends a new active record to the model line.
     * Artifact and sidecar are written before the registry commit; if anything
     * fails the version's files are removed again and the registry is untouched.
     */
    public VersionRecord register(ModelRegistration registration, byte[] artifactBytes) {
        Objects.requireNonNull(registration, "registration");
        Objects.requireNonNull(artifactBytes, "artifactBytes");
        String modelName = ArtifactKeyUtil.requireSafeSegment(registration.getModelName(), "model name");
        if (registryStore.isReservedName(modelName)) {
            throw new IllegalArgumentException("Model name '" + modelName + "' is reserved by the registry");
        }
        if (registration.getModelType() == null || registration.getModelType().isBlank()) {
            throw new IllegalArgumentException("Model type is required");
        }
        Map<String, Double> metrics = registration.getMetrics() == null ? Map.of() : registration.getMetrics();
        metrics.forEach((metric, value) -> {
            if (metric == null || value == null) {
                throw new IllegalArgumentException("Metric '" + metric + "' has no value");
            }
        });
        BumpKind bump = BumpKind.from(registration.getBump());

        try (RegistryLock.Handle ignored = registryLock.acquire()) {
            Registry registry = registryStore.load();
            List<VersionRecord> line = registry.hasModel(modelName) ? registry.line(modelName) : List.of();
            String version = versionAllocator.nextVersion(line, bump).toString();

            VersionRecord record = VersionRecord.builder()
                    .version(version)
                    .modelName(modelName)
                    .modelType(registration.getModelType())
                    .createdAt(clock.instant())
                    .createdBy(orDefault(registration.getCreatedBy(), "system"))
                    .description(orDefault(registration.getDescription(), ""))
                    .metrics(Collections.unmodifiableMap(new LinkedHashMap<>(metrics)))
                    .trainingDataHash(orDefault(registration.getTrainingDataHash(), ""))
                    .trainingSamples(registration.getTrainingSamples())
                    .featureCount(registration.getFeatureCount())
                    .trainingDurationSeconds(registration.getTrainingDurationSeconds())
                    .artifactLocator(artifactStore.artifactLocator(modelName, version))
                    .metadataLocator(artifactStore.metadataLocator(modelName, version))
                    .artifactSha256(Checksums.sha256Hex(artifactBytes))
                    .artifactSizeBytes(artifactBytes.length)
                    .status(VersionStatus.ACTIVE)
                    .production(false)
                    .tags(registration.getTags() == null ? Collections.emptySet()
                            : Collections.unmodifiableSet(new LinkedHashSet<>(registration.getTags())))
                    .build();

            try {
                artifactStore.write(record.getArtifactLocator(), artifactBytes);
                artifactStore.write(record.getMetadataLocator(), sidecar(record));
                registry.append(record);
                registryStore.commit(registry);
            } catch (RuntimeException e) {
                discardArtifacts(modelName, version, e);
                throw e;
            }

            log.info("Registered model {} v{} ({} bytes, {} backend)",
                    modelName, version, artifactBytes.length, artifactStore.name());
            return record;
        }
    }

    /**
     * Points production at {@code version}. Promoting the current production
     * version changes nothing.
     */
    public VersionRecord promote(String modelName, String version) {
        try (RegistryLock.Handle ignored = registryLock.acquire()) {
            Registry registry = registryStore.load();
            VersionRecord target = registry.require(modelName, version);
            Optional<String> previous = registry.productionVersion(modelName);

            if (previous.filter(version::equals).isPresent()) {
                log.info("Model {} v{} is already in production", modelName, version);
                return target;
            }
            if (target.getStatus() == VersionStatus.ARCHIVED) {
                throw new InvalidLifecycleTransitionException(
                        "Cannot promote archived version " + version + " of model " + modelName);
            }
            if (target.getStatus() == VersionStatus.DEPRECATED) {
                log.warn("Promoting deprecated version {} of model {} to production", version, modelName);
            }

            registry.pointProductionAt(modelName, version);
            registryStore.commit(registry);
            log.info("Promoted {} v{} to production (previous: {})", modelName, version, previous.orElse("none"));
            return registry.require(modelName, version);
        }
    }

    /** Marks a version deprecated. A deprecated production version stays in production. */
    public VersionRecord deprecate(String modelName, String version) {
        VersionRecord updated = changeStatus(modelName, version, VersionStatus.DEPRECATED);
        if (updated.isProduction()) {
            log.warn("Model {} v{} is deprecated but still serving production", modelName, version);
        }
        return updated;
    }

    /** Marks a version archived. The production version cannot be archived. */
    public VersionRecord archive(String modelName, String version) {
        return changeStatus(modelName, version, VersionStatus.ARCHIVED);
    }

    private VersionRecord changeStatus(String modelName, String version, VersionStatus target) {
        try (RegistryLock.Handle ignored = registryLock.acquire()) {
            Registry registry = registryStore.load();
            VersionRecord current = registry.require(modelName, version);

            if (current.getStatus() == target) {
                return current;
            }
            if (!current.getStatus().canMoveTo(target)) {
                throw new InvalidLifecycleTransitionException("Cannot move " + modelName + " v" + version
                        + " from " + current.getStatus().getCode() + " to " + target.getCode());
            }
            if (target == VersionStatus.ARCHIVED && current.isProduction()) {
                throw new InvalidLifecycleTransitionException("Cannot archive " + modelName + " v" + version
                        + " while it is the production version; promote another version first");
            }

            VersionRecord updated = current.withStatus(target);
            registry.replace(updated);
            registryStore.commit(registry);
            log.info("Marked {} v{} as {}", modelName, version, target.getCode());
            return updated;
        }
    }

    private byte[] sidecar(VersionRecord record) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new ArtifactWriteFailedException("Failed to serialize metadata for "
                    + record.getModelName() + " v" + record.getVersion(), e);
        }
    }

    private void discardArtifacts(String modelName, String version, RuntimeException cause) {
        try {
            artifactStore.deleteVersion(modelName, version);
        } catch (ArtifactDeleteFailedException e) {
            cause.addSuppressed(e);
            log.warn("Registration of {} v{} failed and its files could not be removed", modelName, version, e);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
