package com.mesh.registry.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CleanupRequest {

    // null falls back to app.registry.default-keep-last-n
    @PositiveOrZero
    private Integer keepLastN;

    private boolean keepProduction = true;
}
