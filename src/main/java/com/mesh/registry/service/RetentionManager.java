package com.mesh.registry.service;

import com.mesh.registry.dto.CleanupFailure;
import com.mesh.registry.dto.CleanupResult;
import com.mesh.registry.exception.ArtifactDeleteFailedException;
import com.mesh.registry.model.Registry;
import com.mesh.registry.model.VersionRecord;
import com.mesh.registry.store.ArtifactStore;
import com.mesh.registry.store.RegistryLock;
import com.mesh.registry.store.RegistryStore;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Removes old versions of a model together with their artifacts.
 *
 * <p>Rules:
 * <ol>
 *   <li>Keep the last {@code keepLastN} versions by creation order.</li>
 *   <li>If {@code keepProduction}, keep the production version wherever it sits.</li>
 *   <li>Everything else is removed: artifact first, then the record. A version
 *       whose artifact cannot be deleted stays and is reported as a failure.</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionManager {

    private final RegistryStore registryStore;
    private final RegistryLock registryLock;
    private final ArtifactStore artifactStore;

    public CleanupResult cleanup(String modelName, int keepLastN) {
        return cleanup(modelName, keepLastN, true);
    }

    public CleanupResult cleanup(String modelName, int keepLastN, boolean keepProduction) {
        if (keepLastN < 0) {
            throw new IllegalArgumentException("keepLastN must be >= 0");
        }

        try (RegistryLock.Handle ignored = registryLock.acquire()) {
            Registry registry = registryStore.load();
            List<VersionRecord> line = registry.line(modelName);
            RetentionPlan plan = plan(line, registry.productionVersion(modelName), keepLastN, keepProduction);

            if (plan.getRemove().isEmpty()) {
                log.info("Nothing to clean up for {} (keepLastN={}, keepProduction={})",
                        modelName, keepLastN, keepProduction);
                return CleanupResult.builder()
                        .modelName(modelName)
                        .removedCount(0)
                        .removedVersions(List.of())
                        .retainedVersions(versions(line))
                        .failures(List.of())
                        .build();
            }

            List<String> removed = new ArrayList<>();
            List<CleanupFailure> failures = new ArrayList<>();
            for (VersionRecord r : plan.getRemove()) {
                try {
                    artifactStore.deleteVersion(modelName, r.getVersion());
                } catch (ArtifactDeleteFailedException e) {
                    log.warn("Failed to remove version {} of {}; keeping its record", r.getVersion(), modelName, e);
                    failures.add(new CleanupFailure(r.getVersion(), e.getMessage()));
                    continue;
                }
                registry.remove(modelName, r.getVersion());
                removed.add(r.getVersion());
            }

            if (!removed.isEmpty()) {
                registryStore.commit(registry);
            }
            log.info("Cleaned up {} versions of {} ({} failed)", removed.size(), modelName, failures.size());

            return CleanupResult.builder()
                    .modelName(modelName)
                    .removedCount(removed.size())
                    .removedVersions(List.copyOf(removed))
                    .retainedVersions(versions(registry.line(modelName)))
                    .failures(List.copyOf(failures))
                    .build();
        }
    }

    /** Splits a line into records to retain and records to remove, both in creation order. */
    static RetentionPlan plan(List<VersionRecord> line,
                              Optional<String> productionVersion,
                              int keepLastN,
                              boolean keepProduction) {
        Set<String> keep = new HashSet<>();
        for (int i = Math.max(0, line.size() - keepLastN); i < line.size(); i++) {
            keep.add(line.get(i).getVersion());
        }
        if (keepProduction) {
            productionVersion.ifPresent(keep::add);
        }

        List<VersionRecord> retain = new ArrayList<>();
        List<VersionRecord> remove = new ArrayList<>();
        for (VersionRecord r : line) {
            (keep.contains(r.getVersion()) ? retain : remove).add(r);
        }
        return new RetentionPlan(List.copyOf(retain), List.copyOf(remove));
    }

    private static List<String> versions(List<VersionRecord> records) {
        return records.stream().map(VersionRecord::getVersion).toList();
    }

    @Value
    static class RetentionPlan {
        List<VersionRecord> retain;
        List<VersionRecord> remove;
    }
}
