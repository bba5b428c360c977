package com.mesh.registry.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mesh.registry.exception.ModelNotFoundException;
import com.mesh.registry.exception.VersionNotFoundException;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate root of the registry document: every model line plus the
 * production pointer of each model.
 *
 * <p>The pointer in {@code currentProduction} is the only source of truth for
 * production state. Every mutation re-derives the {@code production} flag of the
 * affected line from it, so the two never disagree.
 */
@Data
@NoArgsConstructor
@JsonPropertyOrder({"models", "currentProduction", "lastUpdated"})
public class Registry {

    private Map<String, List<VersionRecord>> models = new LinkedHashMap<>();
    private Map<String, String> currentProduction = new LinkedHashMap<>();
    private Instant lastUpdated;

    public boolean hasModel(String modelName) {
        return models.containsKey(modelName);
    }

    /** Records of one model in creation order. */
    public List<VersionRecord> line(String modelName) {
        List<VersionRecord> line = models.get(modelName);
        if (line == null) {
            throw new ModelNotFoundException(modelName);
        }
        return Collections.unmodifiableList(line);
    }

    public Optional<VersionRecord> latest(String modelName) {
        List<VersionRecord> line = line(modelName);
        return line.isEmpty() ? Optional.empty() : Optional.of(line.get(line.size() - 1));
    }

    public Optional<VersionRecord> find(String modelName, String version) {
        return line(modelName).stream()
                .filter(r -> r.getVersion().equals(version))
                .findFirst();
    }

    public VersionRecord require(String modelName, String version) {
        return find(modelName, version)
                .orElseThrow(() -> new VersionNotFoundException(modelName, version));
    }

    public Optional<String> productionVersion(String modelName) {
        return Optional.ofNullable(currentProduction.get(modelName));
    }

    public void append(VersionRecord record) {
        models.computeIfAbsent(record.getModelName(), k -> new ArrayList<>()).add(record);
        syncProductionFlags(record.getModelName());
    }

    /** Swaps in a record with the same model name and version. */
    public void replace(VersionRecord record) {
        List<VersionRecord> line = models.get(record.getModelName());
        if (line == null) {
            throw new ModelNotFoundException(record.getModelName());
        }
        for (int i = 0; i < line.size(); i++) {
            if (line.get(i).getVersion().equals(record.getVersion())) {
                line.set(i, record);
                syncProductionFlags(record.getModelName());
                return;
            }
        }
        throw new VersionNotFoundException(record.getModelName(), record.getVersion());
    }

    public boolean remove(String modelName, String version) {
        List<VersionRecord> line = models.get(modelName);
        if (line == null) {
            return false;
        }
        boolean removed = line.removeIf(r -> r.getVersion().equals(version));
        if (removed && version.equals(currentProduction.get(modelName))) {
            currentProduction.remove(modelName);
        }
        return removed;
    }

    public void pointProductionAt(String modelName, String version) {
        require(modelName, version);
        currentProduction.put(modelName, version);
        syncProductionFlags(modelName);
    }

    public void syncProductionFlags() {
        models.keySet().forEach(this::syncProductionFlags);
    }

    private void syncProductionFlags(String modelName) {
        String pointer = currentProduction.get(modelName);
        List<VersionRecord> line = models.get(modelName);
        for (int i = 0; i < line.size(); i++) {
            VersionRecord r = line.get(i);
            boolean production = r.getVersion().equals(pointer);
            if (r.isProduction() != production) {
                line.set(i, r.withProduction(production));
            }
        }
    }
}
