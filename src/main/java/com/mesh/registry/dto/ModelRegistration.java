package com.mesh.registry.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * What a trainer hands over alongside the artifact bytes. Provenance fields are optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelRegistration {

    // the REST layer fills this from the path
    @Pattern(regexp = "[A-Za-z0-9][A-Za-z0-9._-]*", message = "Model name may contain letters, digits, '.', '_' and '-'")
    private String modelName;

    @NotBlank(message = "Model type is required")
    private String modelType;

    @Builder.Default
    private String description = "";

    @Builder.Default
    private String createdBy = "system";

    @Builder.Default
    private Map<String, @NotNull(message = "Metric value is required") Double> metrics = new LinkedHashMap<>();

    private String trainingDataHash;

    @PositiveOrZero
    private long trainingSamples;

    @PositiveOrZero
    private int featureCount;

    @PositiveOrZero
    private double trainingDurationSeconds;

    @Pattern(regexp = "(?i)major|minor|patch", message = "Bump must be major, minor or patch")
    private String bump;

    @Builder.Default
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> tags = new LinkedHashSet<>();
}
