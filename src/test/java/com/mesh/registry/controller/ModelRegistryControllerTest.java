package com.mesh.registry.controller;

import com.mesh.registry.dto.CleanupResult;
import com.mesh.registry.dto.LoadedModel;
import com.mesh.registry.dto.ModelRegistration;
import com.mesh.registry.exception.InvalidLifecycleTransitionException;
import com.mesh.registry.exception.NoProductionModelException;
import com.mesh.registry.exception.RegistryBusyException;
import com.mesh.registry.exception.VersionNotFoundException;
import com.mesh.registry.model.VersionRecord;
import com.mesh.registry.model.VersionStatus;
import com.mesh.registry.service.ModelRegistryService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ModelRegistryController.class)
class ModelRegistryControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    ModelRegistryService registryService;

    private static VersionRecord record(String version, boolean production) {
        return VersionRecord.builder()
                .modelName("risk_scorer")
                .modelType("classification")
                .version(version)
                .createdAt(Instant.parse("2025-03-01T10:15:30Z"))
                .metrics(Map.of("accuracy", 0.85))
                .artifactLocator("risk_scorer/" + version + "/model.bin")
                .production(production)
                .build();
    }

    @Test
    void registerStoresUploadedArtifact() throws Exception {
        when(registryService.register(any(ModelRegistration.class), any(byte[].class)))
                .thenReturn(record("1.0.0", false));

        MockMultipartFile metadata = new MockMultipartFile("metadata", "", MediaType.APPLICATION_JSON_VALUE,
                "{\"modelType\":\"classification\",\"metrics\":{\"accuracy\":0.85},\"bump\":\"minor\"}"
                        .getBytes(StandardCharsets.UTF_8));
        MockMultipartFile artifact = new MockMultipartFile("artifact", "model.bin",
                MediaType.APPLICATION_OCTET_STREAM_VALUE, new byte[]{1, 2, 3});

        mvc.perform(multipart("/api/registry/models/risk_scorer/versions").file(metadata).file(artifact))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.version").value("1.0.0"))
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.isProduction").value(false));

        ArgumentCaptor<ModelRegistration> reg = ArgumentCaptor.forClass(ModelRegistration.class);
        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(registryService).register(reg.capture(), bytes.capture());
        assertEquals("risk_scorer", reg.getValue().getModelName());
        assertEquals("minor", reg.getValue().getBump());
        assertArrayEquals(new byte[]{1, 2, 3}, bytes.getValue());
    }

    @Test
    void registerWithoutModelTypeIsRejected() throws Exception {
        MockMultipartFile metadata = new MockMultipartFile("metadata", "", MediaType.APPLICATION_JSON_VALUE,
                "{\"description\":\"no type\"}".getBytes(StandardCharsets.UTF_8));
        MockMultipartFile artifact = new MockMultipartFile("artifact", "model.bin",
                MediaType.APPLICATION_OCTET_STREAM_VALUE, new byte[]{1});

        mvc.perform(multipart("/api/registry/models/risk_scorer/versions").file(metadata).file(artifact))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));

        verifyNoInteractions(registryService);
    }

    @Test
    void registerWithNullMetricIsRejected() throws Exception {
        MockMultipartFile metadata = new MockMultipartFile("metadata", "", MediaType.APPLICATION_JSON_VALUE,
                "{\"modelType\":\"classification\",\"metrics\":{\"accuracy\":null}}"
                        .getBytes(StandardCharsets.UTF_8));
        MockMultipartFile artifact = new MockMultipartFile("artifact", "model.bin",
                MediaType.APPLICATION_OCTET_STREAM_VALUE, new byte[]{1});

        mvc.perform(multipart("/api/registry/models/risk_scorer/versions").file(metadata).file(artifact))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));

        verifyNoInteractions(registryService);
    }

    @Test
    void promoteOfUnknownVersionIsNotFound() throws Exception {
        when(registryService.promote("risk_scorer", "9.9.9"))
                .thenThrow(new VersionNotFoundException("risk_scorer", "9.9.9"));

        mvc.perform(post("/api/registry/models/risk_scorer/versions/9.9.9/promote"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("VERSION_NOT_FOUND"));
    }

    @Test
    void promoteReturnsTheProductionRecord() throws Exception {
        when(registryService.promote("risk_scorer", "1.0.1")).thenReturn(record("1.0.1", true));

        mvc.perform(post("/api/registry/models/risk_scorer/versions/1.0.1/promote"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("1.0.1"))
                .andExpect(jsonPath("$.isProduction").value(true));
    }

    @Test
    void archivingProductionIsABadRequest() throws Exception {
        when(registryService.archive("risk_scorer", "1.0.0"))
                .thenThrow(new InvalidLifecycleTransitionException("production"));

        mvc.perform(post("/api/registry/models/risk_scorer/versions/1.0.0/archive"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void busyRegistryIsServiceUnavailable() throws Exception {
        when(registryService.deprecate("risk_scorer", "1.0.0"))
                .thenThrow(new RegistryBusyException("busy"));

        mvc.perform(post("/api/registry/models/risk_scorer/versions/1.0.0/deprecate"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("REGISTRY_BUSY"));
    }

    @Test
    void productionArtifactIsDownloaded() throws Exception {
        when(registryService.getProductionArtifact("risk_scorer"))
                .thenReturn(new LoadedModel(record("1.0.1", true), new byte[]{9, 9}));

        mvc.perform(get("/api/registry/models/risk_scorer/production/artifact"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Model-Version", "1.0.1"))
                .andExpect(content().contentType(MediaType.APPLICATION_OCTET_STREAM))
                .andExpect(content().bytes(new byte[]{9, 9}));
    }

    @Test
    void missingProductionIsNotFound() throws Exception {
        when(registryService.getProductionArtifact("risk_scorer"))
                .thenThrow(new NoProductionModelException("risk_scorer"));

        mvc.perform(get("/api/registry/models/risk_scorer/production"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NO_PRODUCTION_MODEL"));
    }

    @Test
    void listPassesStatusFilter() throws Exception {
        when(registryService.list("risk_scorer", VersionStatus.DEPRECATED)).thenReturn(List.of(record("1.0.0", false)));

        mvc.perform(get("/api/registry/models/risk_scorer/versions").param("status", "deprecated"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].version").value("1.0.0"));
    }

    @Test
    void unknownStatusFilterIsABadRequest() throws Exception {
        mvc.perform(get("/api/registry/models").param("status", "retired"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void cleanupWithoutBodyUsesDefaults() throws Exception {
        when(registryService.cleanup(eq("risk_scorer"), isNull(), eq(true))).thenReturn(CleanupResult.builder()
                .modelName("risk_scorer")
                .removedCount(1)
                .removedVersions(List.of("1.0.0"))
                .retainedVersions(List.of("1.0.1", "1.0.2"))
                .failures(List.of())
                .build());

        mvc.perform(post("/api/registry/models/risk_scorer/cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removedCount").value(1))
                .andExpect(jsonPath("$.retainedVersions[1]").value("1.0.2"));
    }

    @Test
    void cleanupBodyIsValidated() throws Exception {
        mvc.perform(post("/api/registry/models/risk_scorer/cleanup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keepLastN\":-1}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(registryService);
    }

    @Test
    void summaryIsPlainText() throws Exception {
        when(registryService.summary()).thenReturn("MODEL REGISTRY SUMMARY");

        mvc.perform(get("/api/registry/summary"))
                .andExpect(status().isOk())
                .andExpect(content().string("MODEL REGISTRY SUMMARY"));
    }
}
