package com.mesh.registry.dto;

import com.mesh.registry.model.VersionRecord;
import lombok.Value;

/** Artifact bytes together with the record that describes them. */
@Value
public class LoadedModel {
    VersionRecord record;
    byte[] artifact;
}
