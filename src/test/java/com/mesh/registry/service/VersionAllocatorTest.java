package com.mesh.registry.service;

import com.mesh.registry.exception.InvalidVersionFormatException;
import com.mesh.registry.model.BumpKind;
import com.mesh.registry.model.SemanticVersion;
import com.mesh.registry.model.VersionRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VersionAllocatorTest {

    private final VersionAllocator allocator = new VersionAllocator();

    private static VersionRecord at(String version) {
        return VersionRecord.builder().modelName("m").modelType("t").version(version).build();
    }

    @Test
    void emptyLineStartsAtInitialVersion() {
        assertEquals(SemanticVersion.INITIAL, allocator.nextVersion(List.of(), BumpKind.MAJOR));
        assertEquals("1.0.0", allocator.nextVersion(List.of(), BumpKind.PATCH).toString());
    }

    @Test
    void bumpsTheLatestRecord() {
        List<VersionRecord> line = List.of(at("1.0.0"), at("1.2.3"));

        assertEquals("1.2.4", allocator.nextVersion(line, BumpKind.PATCH).toString());
        assertEquals("1.3.0", allocator.nextVersion(line, BumpKind.MINOR).toString());
        assertEquals("2.0.0", allocator.nextVersion(line, BumpKind.MAJOR).toString());
        assertEquals("1.2.4", allocator.nextVersion(line, null).toString());
    }

    @Test
    void malformedLatestVersionFails() {
        assertThrows(InvalidVersionFormatException.class,
                () -> allocator.nextVersion(List.of(at("1.0")), BumpKind.PATCH));
    }
}
