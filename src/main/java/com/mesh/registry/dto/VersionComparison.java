package com.mesh.registry.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Differences between two versions of one model, always expressed as v2 minus v1.
 */
@Value
@Builder
public class VersionComparison {
    String modelName;
    String version1;
    String version2;
    long createdAtDiffDays;
    Map<String, MetricDelta> metricsComparison;
    long trainingSamplesDiff;
    int featureCountDiff;
}
