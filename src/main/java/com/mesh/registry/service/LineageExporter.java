package com.mesh.registry.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mesh.registry.dto.LineageReport;
import com.mesh.registry.model.Registry;
import com.mesh.registry.model.VersionRecord;
import com.mesh.registry.store.AtomicFiles;
import com.mesh.registry.store.RegistryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Read-only audit view of a model line. Works on one registry snapshot and
 * does not take the registry lock.
 */
@Slf4j
@Service
public class LineageExporter {

    private final RegistryStore registryStore;
    private final ObjectMapper mapper;
    private final Clock clock;

    public LineageExporter(RegistryStore registryStore, ObjectMapper mapper, Clock clock) {
        this.registryStore = registryStore;
        this.mapper = mapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }

    public LineageReport exportLineage(String modelName) {
        Registry registry = registryStore.load();
        List<VersionRecord> line = registry.line(modelName);
        return LineageReport.builder()
                .modelName(modelName)
                .generatedAt(clock.instant())
                .totalVersions(line.size())
                .currentProduction(registry.productionVersion(modelName).orElse(null))
                .versionHistory(List.copyOf(line))
                .build();
    }

    /** Writes the report as JSON to {@code outputPath}, creating parent directories. */
    public LineageReport exportLineage(String modelName, Path outputPath) {
        LineageReport report = exportLineage(modelName);
        try {
            AtomicFiles.write(outputPath, mapper.writeValueAsBytes(report));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write lineage report to " + outputPath, e);
        }
        log.info("Lineage of {} exported to {}", modelName, outputPath);
        return report;
    }
}
