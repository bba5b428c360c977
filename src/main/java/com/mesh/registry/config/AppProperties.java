package com.mesh.registry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private RegistrySettings registry = new RegistrySettings();

    @Data
    public static class RegistrySettings {
        private String baseDir = "models";
        private String registryFile = "registry.json";
        private Duration lockTimeout = Duration.ofSeconds(10);
        // local | s3
        private String artifactBackend = "local";
        private String artifactFileName = "model.bin";
        private String metadataFileName = "metadata.json";
        private int defaultKeepLastN = 5;
        private S3Settings s3 = new S3Settings();

        public Path baseDirPath() {
            return Path.of(baseDir).toAbsolutePath().normalize();
        }

        public Path registryPath() {
            return baseDirPath().resolve(registryFile);
        }

        public Path lockPath() {
            return baseDirPath().resolve(registryFile + ".lock");
        }
    }

    @Data
    public static class S3Settings {
        private String region;
        private String bucket;
        private String prefix = "models";
        private String endpoint;
    }
}
