package com.mesh.registry.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.utils.StringUtils;

import java.net.URI;

/**
 * S3 client for the S3 artifact backend. Only created when
 * {@code app.registry.artifact-backend=s3}.
 */
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.registry", name = "artifact-backend", havingValue = "s3")
public class S3Config {

    private final AppProperties props;

    private Region resolveRegion() {
        String r = props.getRegistry().getS3().getRegion();
        if (r == null || r.isBlank()) {
            return Region.US_EAST_1;
        }
        return Region.of(r);
    }

    @Bean
    public S3Client s3Client() {
        S3ClientBuilder builder = S3Client.builder()
                .region(resolveRegion())
                .credentialsProvider(DefaultCredentialsProvider.create());

        String endpointOverride = props.getRegistry().getS3().getEndpoint();
        if (!StringUtils.isBlank(endpointOverride)) {
            builder = builder.endpointOverride(URI.create(endpointOverride));
        }

        return builder.build();
    }
}
