package com.mesh.registry.service;

import com.mesh.registry.config.AppProperties;
import com.mesh.registry.dto.CleanupResult;
import com.mesh.registry.dto.LineageReport;
import com.mesh.registry.dto.LoadedModel;
import com.mesh.registry.dto.MetricDelta;
import com.mesh.registry.dto.ModelRegistration;
import com.mesh.registry.dto.VersionComparison;
import com.mesh.registry.exception.ArtifactReadFailedException;
import com.mesh.registry.exception.ModelNotFoundException;
import com.mesh.registry.exception.NoProductionModelException;
import com.mesh.registry.exception.RegistryException;
import com.mesh.registry.model.Registry;
import com.mesh.registry.model.VersionRecord;
import com.mesh.registry.model.VersionStatus;
import com.mesh.registry.store.ArtifactStore;
import com.mesh.registry.store.RegistryStore;
import com.mesh.registry.util.Checksums;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point used by trainers, the serving layer and operators. Mutations are
 * delegated to {@link PromotionManager} and {@link RetentionManager}; the reads
 * here work on a single registry snapshot without locking.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistryService {

    private static final DateTimeFormatter SUMMARY_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter SUMMARY_DATE =
            DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final String RULE = "=".repeat(60);

    private final RegistryStore registryStore;
    private final ArtifactStore artifactStore;
    private final PromotionManager promotionManager;
    private final RetentionManager retentionManager;
    private final LineageExporter lineageExporter;
    private final AppProperties props;
    private final Clock clock;

    /* -------------------- Mutations -------------------- */

    public VersionRecord register(ModelRegistration registration, byte[] artifactBytes) {
        return promotionManager.register(registration, artifactBytes);
    }

    public VersionRecord promote(String modelName, String version) {
        return promotionManager.promote(modelName, version);
    }

    public VersionRecord deprecate(String modelName, String version) {
        return promotionManager.deprecate(modelName, version);
    }

    public VersionRecord archive(String modelName, String version) {
        return promotionManager.archive(modelName, version);
    }

    public CleanupResult cleanup(String modelName, Integer keepLastN, boolean keepProduction) {
        int n = keepLastN == null ? props.getRegistry().getDefaultKeepLastN() : keepLastN;
        return retentionManager.cleanup(modelName, n, keepProduction);
    }

    /* -------------------- Reads -------------------- */

    public LineageReport exportLineage(String modelName) {
        return lineageExporter.exportLineage(modelName);
    }

    public LineageReport exportLineage(String modelName, Path outputPath) {
        return lineageExporter.exportLineage(modelName, outputPath);
    }

    public VersionRecord getVersion(String modelName, String version) {
        return registryStore.load().require(modelName, version);
    }

    /**
     * Loads an artifact. Without a version this is the production version if one
     * was promoted, else the latest registered version.
     */
    public LoadedModel load(String modelName, String version) {
        Registry registry = registryStore.load();
        VersionRecord record;
        if (version == null || version.isBlank()) {
            String resolved = registry.productionVersion(modelName)
                    .or(() -> registry.latest(modelName).map(VersionRecord::getVersion))
                    .orElseThrow(() -> new ModelNotFoundException(modelName));
            record = registry.require(modelName, resolved);
        } else {
            record = registry.require(modelName, version);
        }
        LoadedModel loaded = new LoadedModel(record, readVerified(record));
        log.info("Loaded model {} v{}", modelName, record.getVersion());
        return loaded;
    }

    public LoadedModel getProductionArtifact(String modelName) {
        Registry registry = registryStore.load();
        if (!registry.hasModel(modelName)) {
            throw new ModelNotFoundException(modelName);
        }
        String version = registry.productionVersion(modelName)
                .orElseThrow(() -> new NoProductionModelException(modelName));
        VersionRecord record = registry.require(modelName, version);
        return new LoadedModel(record, readVerified(record));
    }

    /** Every promoted model; models whose artifact is missing or cannot be loaded are skipped. */
    public Map<String, LoadedModel> getProductionModels() {
        Registry registry = registryStore.load();
        Map<String, LoadedModel> out = new LinkedHashMap<>();
        registry.getCurrentProduction().forEach((modelName, version) -> {
            VersionRecord record = registry.require(modelName, version);
            if (!artifactStore.exists(record.getArtifactLocator())) {
                log.warn("Production model {} v{} has no artifact at {}", modelName, version,
                        record.getArtifactLocator());
                return;
            }
            try {
                out.put(modelName, new LoadedModel(record, readVerified(record)));
            } catch (RegistryException e) {
                log.warn("Failed to load production model {}: {}", modelName, e.getMessage());
            }
        });
        return out;
    }

    /** Records across models (or of one model) in creation order, optionally filtered by status. */
    public List<VersionRecord> list(String modelName, VersionStatus status) {
        Registry registry = registryStore.load();
        if (modelName != null && !modelName.isBlank() && !registry.hasModel(modelName)) {
            throw new ModelNotFoundException(modelName);
        }
        List<VersionRecord> out = new ArrayList<>();
        registry.getModels().forEach((name, line) -> {
            if (modelName != null && !modelName.isBlank() && !name.equals(modelName)) {
                return;
            }
            for (VersionRecord r : line) {
                if (status == null || r.getStatus() == status) {
                    out.add(r);
                }
            }
        });
        return out;
    }

    /** Compares v2 against v1; a metric missing on one side counts as 0. */
    public VersionComparison compareVersions(String modelName, String version1, String version2) {
        Registry registry = registryStore.load();
        VersionRecord v1 = registry.require(modelName, version1);
        VersionRecord v2 = registry.require(modelName, version2);

        Set<String> metricNames = new LinkedHashSet<>(v1.getMetrics().keySet());
        metricNames.addAll(v2.getMetrics().keySet());
        Map<String, MetricDelta> metrics = new LinkedHashMap<>();
        for (String metric : metricNames) {
            metrics.put(metric, MetricDelta.of(metricOrZero(v1, metric), metricOrZero(v2, metric)));
        }

        return VersionComparison.builder()
                .modelName(modelName)
                .version1(version1)
                .version2(version2)
                .createdAtDiffDays(Duration.between(v1.getCreatedAt(), v2.getCreatedAt()).toDays())
                .metricsComparison(metrics)
                .trainingSamplesDiff(v2.getTrainingSamples() - v1.getTrainingSamples())
                .featureCountDiff(v2.getFeatureCount() - v1.getFeatureCount())
                .build();
    }

    public String summary() {
        Registry registry = registryStore.load();
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("MODEL REGISTRY SUMMARY");
        lines.add("Generated: " + SUMMARY_TIME.format(clock.instant()));
        lines.add(RULE);
        lines.add("");

        int totalVersions = registry.getModels().values().stream().mapToInt(List::size).sum();
        lines.add("Total Models: " + registry.getModels().size());
        lines.add("Total Versions: " + totalVersions);
        lines.add("");

        registry.getModels().forEach((name, versions) -> {
            lines.add(name);
            lines.add("   Versions: " + versions.size());
            if (!versions.isEmpty()) {
                VersionRecord latest = versions.get(versions.size() - 1);
                lines.add("   Latest: v" + latest.getVersion() + " (" + SUMMARY_DATE.format(latest.getCreatedAt()) + ")");

                registry.productionVersion(name).ifPresent(prod -> {
                    lines.add("   Production: v" + prod);
                    if (registry.require(name, prod).getStatus() == VersionStatus.DEPRECATED) {
                        lines.add("   WARNING: production version v" + prod + " is deprecated");
                    }
                });

                if (!latest.getMetrics().isEmpty()) {
                    lines.add("   Metrics: " + latest.getMetrics().entrySet().stream()
                            .limit(3)
                            .map(e -> e.getKey() + "=" + String.format(Locale.ROOT, "%.4f", e.getValue()))
                            .collect(Collectors.joining(", ")));
                }
            }
            lines.add("");
        });

        return String.join("\n", lines);
    }

    private static double metricOrZero(VersionRecord record, String metric) {
        Double value = record.getMetrics().get(metric);
        return value == null ? 0.0 : value;
    }

    private byte[] readVerified(VersionRecord record) {
        byte[] bytes = artifactStore.read(record.getArtifactLocator());
        String expected = record.getArtifactSha256();
        if (expected != null && !expected.equals(Checksums.sha256Hex(bytes))) {
            log.error("Checksum mismatch for {} v{} at {}", record.getModelName(), record.getVersion(),
                    record.getArtifactLocator());
            throw new ArtifactReadFailedException("Artifact of " + record.getModelName() + " v" + record.getVersion()
                    + " does not match its recorded SHA-256");
        }
        return bytes;
    }
}
