package com.mesh.registry.service;

import com.mesh.registry.model.BumpKind;
import com.mesh.registry.model.SemanticVersion;
import com.mesh.registry.model.VersionRecord;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the version a new registration receives. Depends only on the latest
 * record of the line.
 */
@Component
public class VersionAllocator {

    /**
     * @param line records of one model in creation order, possibly empty
     * @throws com.mesh.registry.exception.InvalidVersionFormatException if the latest version does not parse
     */
    public SemanticVersion nextVersion(List<VersionRecord> line, BumpKind bump) {
        if (line == null || line.isEmpty()) {
            return SemanticVersion.INITIAL;
        }
        SemanticVersion latest = SemanticVersion.parse(line.get(line.size() - 1).getVersion());
        return latest.bump(bump == null ? BumpKind.PATCH : bump);
    }
}
