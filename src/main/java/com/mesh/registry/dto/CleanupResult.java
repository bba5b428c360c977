package com.mesh.registry.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CleanupResult {
    String modelName;
    int removedCount;
    List<String> removedVersions;
    List<String> retainedVersions;
    List<CleanupFailure> failures;
}
