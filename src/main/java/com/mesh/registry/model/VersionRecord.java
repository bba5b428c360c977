package com.mesh.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One registered model artifact. Only {@code status} and {@code production}
 * change after the record is appended to its model line.
 *
 * <p>{@code production} is a view of the registry's production pointer; it is
 * written out for readers of the document but ignored when the document is read back.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(value = {"isProduction"}, allowGetters = true)
@JsonPropertyOrder({
        "version", "modelName", "modelType", "createdAt", "createdBy", "description",
        "metrics", "trainingDataHash", "trainingSamples", "featureCount", "trainingDurationSeconds",
        "artifactLocator", "metadataLocator", "artifactSha256", "artifactSizeBytes",
        "status", "isProduction", "tags"
})
public class VersionRecord {

    String version;
    String modelName;
    String modelType;
    Instant createdAt;

    @Builder.Default
    String createdBy = "system";

    @Builder.Default
    String description = "";

    @Builder.Default
    @JsonDeserialize(as = LinkedHashMap.class)
    Map<String, Double> metrics = Map.of();

    @Builder.Default
    String trainingDataHash = "";

    long trainingSamples;
    int featureCount;
    double trainingDurationSeconds;

    String artifactLocator;
    String metadataLocator;
    String artifactSha256;
    long artifactSizeBytes;

    @With
    @Builder.Default
    VersionStatus status = VersionStatus.ACTIVE;

    @With
    @JsonProperty("isProduction")
    boolean production;

    @Builder.Default
    @JsonDeserialize(as = LinkedHashSet.class)
    Set<String> tags = Set.of();

    /** Metrics in the order they were registered; read-only. */
    public Map<String, Double> getMetrics() {
        return metrics == null ? Map.of() : Collections.unmodifiableMap(metrics);
    }

    /** Tags in the order they were registered; read-only. */
    public Set<String> getTags() {
        return tags == null ? Set.of() : Collections.unmodifiableSet(tags);
    }

    public SemanticVersion semanticVersion() {
        return SemanticVersion.parse(version);
    }
}
