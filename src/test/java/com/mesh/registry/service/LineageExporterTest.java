package com.mesh.registry.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mesh.registry.RegistryTestSupport;
import com.mesh.registry.dto.LineageReport;
import com.mesh.registry.exception.ModelNotFoundException;
import com.mesh.registry.model.VersionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.mesh.registry.RegistryTestSupport.artifact;
import static com.mesh.registry.RegistryTestSupport.registration;
import static org.junit.jupiter.api.Assertions.*;

class LineageExporterTest {

    @TempDir
    Path baseDir;

    private RegistryTestSupport support;

    @BeforeEach
    void setUp() {
        support = new RegistryTestSupport(baseDir);
        support.promotionManager.register(registration("fraud"), artifact("a"));
        support.promotionManager.register(registration("fraud", "minor"), artifact("b"));
        support.promotionManager.promote("fraud", "1.0.0");
    }

    @Test
    void reportListsTheWholeLineInOrder() {
        LineageReport report = support.lineageExporter.exportLineage("fraud");

        assertEquals("fraud", report.getModelName());
        assertEquals(RegistryTestSupport.NOW, report.getGeneratedAt());
        assertEquals(2, report.getTotalVersions());
        assertEquals("1.0.0", report.getCurrentProduction());
        assertEquals(List.of("1.0.0", "1.1.0"),
                report.getVersionHistory().stream().map(VersionRecord::getVersion).toList());
        assertTrue(report.getVersionHistory().get(0).isProduction());
    }

    @Test
    void reportWithoutProductionHasNoPointer() {
        support.promotionManager.register(registration("other"), artifact("c"));

        LineageReport report = support.lineageExporter.exportLineage("other");

        assertNull(report.getCurrentProduction());
        assertEquals(1, report.getTotalVersions());
    }

    @Test
    void reportIsWrittenAsJson() throws Exception {
        Path out = baseDir.resolve("reports/fraud_lineage.json");

        support.lineageExporter.exportLineage("fraud", out);

        JsonNode doc = support.mapper.readTree(out.toFile());
        assertEquals("fraud", doc.get("modelName").asText());
        assertEquals(2, doc.get("totalVersions").asInt());
        assertEquals("1.0.0", doc.get("currentProduction").asText());
        assertEquals("2025-03-01T10:15:30Z", doc.get("generatedAt").asText());
        assertEquals("1.1.0", doc.at("/versionHistory/1/version").asText());

        LineageReport parsed = support.mapper.readValue(out.toFile(), LineageReport.class);
        assertEquals(2, parsed.getVersionHistory().size());
    }

    @Test
    void unknownModelFails() {
        assertThrows(ModelNotFoundException.class, () -> support.lineageExporter.exportLineage("ghost"));
    }
}
