package com.mesh.registry;

import com.mesh.registry.dto.CleanupResult;
import com.mesh.registry.exception.VersionNotFoundException;
import com.mesh.registry.model.VersionRecord;
import com.mesh.registry.service.ModelRegistryService;
import com.mesh.registry.store.ArtifactStore;
import com.mesh.registry.store.LocalArtifactStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.mesh.registry.RegistryTestSupport.artifact;
import static com.mesh.registry.RegistryTestSupport.registration;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ModelRegistryServiceApplicationTests {

    @TempDir
    static Path registryDir;

    @DynamicPropertySource
    static void registryProperties(DynamicPropertyRegistry registry) {
        registry.add("app.registry.base-dir", () -> registryDir.toString());
        registry.add("app.registry.artifact-backend", () -> "local");
    }

    @Autowired
    ModelRegistryService registryService;

    @Autowired
    ArtifactStore artifactStore;

    @Test
    void contextUsesTheLocalBackend() {
        assertInstanceOf(LocalArtifactStore.class, artifactStore);
    }

    @Test
    void registerPromoteAndCleanUp() {
        registryService.register(registration("risk_scorer"), artifact("v1"));
        registryService.register(registration("risk_scorer"), artifact("v2"));
        registryService.register(registration("risk_scorer"), artifact("v3"));
        registryService.promote("risk_scorer", "1.0.1");

        assertThrows(VersionNotFoundException.class, () -> registryService.promote("risk_scorer", "9.9.9"));
        assertEquals("1.0.1", registryService.getProductionArtifact("risk_scorer").getRecord().getVersion());

        CleanupResult result = registryService.cleanup("risk_scorer", 1, true);

        assertEquals(1, result.getRemovedCount());
        assertEquals(List.of("1.0.1", "1.0.2"),
                registryService.list("risk_scorer", null).stream().map(VersionRecord::getVersion).toList());
        assertArrayEquals(artifact("v2"), registryService.getProductionArtifact("risk_scorer").getArtifact());
        assertTrue(Files.isRegularFile(registryDir.resolve("registry.json")));
    }
}
