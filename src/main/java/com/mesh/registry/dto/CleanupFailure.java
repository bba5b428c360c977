package com.mesh.registry.dto;

import lombok.Value;

/** A version cleanup wanted to remove but left in place. */
@Value
public class CleanupFailure {
    String version;
    String reason;
}
