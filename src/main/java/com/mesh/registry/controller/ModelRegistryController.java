package com.mesh.registry.controller;

import com.mesh.registry.dto.CleanupRequest;
import com.mesh.registry.dto.CleanupResult;
import com.mesh.registry.dto.LineageReport;
import com.mesh.registry.dto.LoadedModel;
import com.mesh.registry.dto.ModelRegistration;
import com.mesh.registry.dto.VersionComparison;
import com.mesh.registry.model.VersionRecord;
import com.mesh.registry.model.VersionStatus;
import com.mesh.registry.service.ModelRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/registry")
@RequiredArgsConstructor
@Slf4j
public class ModelRegistryController {

    private final ModelRegistryService registryService;

    /**
     * Register a new version
     * POST /api/registry/models/{modelName}/versions (multipart: artifact, metadata)
     */
    @PostMapping(value = "/models/{modelName}/versions", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<VersionRecord> register(
            @PathVariable String modelName,
            @Valid @RequestPart("metadata") ModelRegistration metadata,
            @RequestPart("artifact") MultipartFile artifact) throws IOException {

        if (artifact.isEmpty()) {
            throw new IllegalArgumentException("Artifact file is empty");
        }
        metadata.setModelName(modelName);
        log.info("Registering new version of {} ({} bytes)", modelName, artifact.getSize());

        VersionRecord record = registryService.register(metadata, artifact.getBytes());
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    @GetMapping("/models")
    public List<VersionRecord> listAll(@RequestParam(value = "status", required = false) String status) {
        return registryService.list(null, parseStatus(status));
    }

    @GetMapping("/models/{modelName}/versions")
    public List<VersionRecord> listVersions(
            @PathVariable String modelName,
            @RequestParam(value = "status", required = false) String status) {
        return registryService.list(modelName, parseStatus(status));
    }

    @GetMapping("/models/{modelName}/versions/{version}")
    public VersionRecord getVersion(@PathVariable String modelName, @PathVariable String version) {
        return registryService.getVersion(modelName, version);
    }

    @GetMapping("/models/{modelName}/versions/{version}/artifact")
    public ResponseEntity<byte[]> downloadVersion(@PathVariable String modelName, @PathVariable String version) {
        return download(registryService.load(modelName, version));
    }

    @GetMapping("/models/{modelName}/production")
    public VersionRecord getProduction(@PathVariable String modelName) {
        return registryService.getProductionArtifact(modelName).getRecord();
    }

    /**
     * Artifact of the serving version
     * GET /api/registry/models/{modelName}/production/artifact
     */
    @GetMapping("/models/{modelName}/production/artifact")
    public ResponseEntity<byte[]> downloadProduction(@PathVariable String modelName) {
        return download(registryService.getProductionArtifact(modelName));
    }

    @PostMapping("/models/{modelName}/versions/{version}/promote")
    public VersionRecord promote(@PathVariable String modelName, @PathVariable String version) {
        log.info("Promotion requested for {} v{}", modelName, version);
        return registryService.promote(modelName, version);
    }

    @PostMapping("/models/{modelName}/versions/{version}/deprecate")
    public VersionRecord deprecate(@PathVariable String modelName, @PathVariable String version) {
        return registryService.deprecate(modelName, version);
    }

    @PostMapping("/models/{modelName}/versions/{version}/archive")
    public VersionRecord archive(@PathVariable String modelName, @PathVariable String version) {
        return registryService.archive(modelName, version);
    }

    @GetMapping("/models/{modelName}/lineage")
    public LineageReport lineage(@PathVariable String modelName) {
        return registryService.exportLineage(modelName);
    }

    @GetMapping("/models/{modelName}/compare")
    public VersionComparison compare(
            @PathVariable String modelName,
            @RequestParam("v1") String v1,
            @RequestParam("v2") String v2) {
        return registryService.compareVersions(modelName, v1, v2);
    }

    /**
     * Remove old versions
     * POST /api/registry/models/{modelName}/cleanup
     */
    @PostMapping("/models/{modelName}/cleanup")
    public CleanupResult cleanup(
            @PathVariable String modelName,
            @Valid @RequestBody(required = false) CleanupRequest request) {
        CleanupRequest effective = request != null ? request : new CleanupRequest();
        log.info("Cleanup requested for {} (keepLastN={}, keepProduction={})",
                modelName, effective.getKeepLastN(), effective.isKeepProduction());
        return registryService.cleanup(modelName, effective.getKeepLastN(), effective.isKeepProduction());
    }

    @GetMapping(value = "/summary", produces = MediaType.TEXT_PLAIN_VALUE)
    public String summary() {
        return registryService.summary();
    }

    private static VersionStatus parseStatus(String status) {
        return (status == null || status.isBlank()) ? null : VersionStatus.from(status);
    }

    private static ResponseEntity<byte[]> download(LoadedModel loaded) {
        VersionRecord record = loaded.getRecord();
        String filename = record.getModelName() + "-" + record.getVersion() + ".bin";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, contentDisposition(filename))
                .header("X-Model-Version", record.getVersion())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .contentLength(loaded.getArtifact().length)
                .body(loaded.getArtifact());
    }

    private static String contentDisposition(String filename) {
        String encoded = URLEncoder.encode(filename, StandardCharsets.UTF_8).replaceAll("\\+", "%20");
        return "attachment; filename=\"" + filename + "\"; filename*=UTF-8''" + encoded;
    }
}
