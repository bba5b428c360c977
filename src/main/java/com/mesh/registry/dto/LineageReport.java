package com.mesh.registry.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mesh.registry.model.VersionRecord;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Audit projection of one model line. {@code versionHistory} holds every record
 * currently in the line, in creation order.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({"modelName", "generatedAt", "totalVersions", "currentProduction", "versionHistory"})
public class LineageReport {
    String modelName;
    Instant generatedAt;
    int totalVersions;
    String currentProduction;
    List<VersionRecord> versionHistory;
}
