package com.mesh.registry.store;

import com.mesh.registry.config.AppProperties;
import com.mesh.registry.exception.ArtifactDeleteFailedException;
import com.mesh.registry.exception.ArtifactReadFailedException;
import com.mesh.registry.exception.ArtifactWriteFailedException;
import com.mesh.registry.util.ArtifactKeyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;

/**
 * Artifacts in S3 under {@code <prefix>/<model>/<version>/<file>}. Locators are
 * {@code s3://bucket/key} URIs. The registry document itself stays on local disk.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.registry", name = "artifact-backend", havingValue = "s3")
public class S3ArtifactStore implements ArtifactStore {

    private static final String OCTET_STREAM = "application/octet-stream";
    private static final String JSON = "application/json";

    private final S3Client s3;
    private final String bucket;
    private final String prefix;
    private final String artifactFileName;
    private final String metadataFileName;

    @Autowired
    public S3ArtifactStore(S3Client s3, AppProperties props) {
        this(s3,
                props.getRegistry().getS3().getBucket(),
                props.getRegistry().getS3().getPrefix(),
                props.getRegistry().getArtifactFileName(),
                props.getRegistry().getMetadataFileName());
    }

    public S3ArtifactStore(S3Client s3, String bucket, String prefix, String artifactFileName, String metadataFileName) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalStateException("S3 bucket name not configured (app.registry.s3.bucket)");
        }
        this.s3 = s3;
        this.bucket = bucket.trim().replaceFirst("^s3://", "").replaceAll("/+$", "");
        this.prefix = prefix == null ? "" : prefix;
        this.artifactFileName = ArtifactKeyUtil.requireSafeSegment(artifactFileName, "artifact file name");
        this.metadataFileName = ArtifactKeyUtil.requireSafeSegment(metadataFileName, "metadata file name");
    }

    @Override
    public String name() {
        return "s3";
    }

    @Override
    public String artifactLocator(String modelName, String version) {
        return ArtifactKeyUtil.s3Uri(bucket, ArtifactKeyUtil.join(versionPrefix(modelName, version), artifactFileName));
    }

    @Override
    public String metadataLocator(String modelName, String version) {
        return ArtifactKeyUtil.s3Uri(bucket, ArtifactKeyUtil.join(versionPrefix(modelName, version), metadataFileName));
    }

    @Override
    public void write(String locator, byte[] bytes) {
        String key = keyOf(locator);
        try {
            s3.putObject(
                    PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(key.endsWith(".json") ? JSON : OCTET_STREAM)
                            .build(),
                    RequestBody.fromBytes(bytes)
            );
        } catch (SdkException e) {
            throw new ArtifactWriteFailedException("Failed to write artifact to S3: " + locator, e);
        }
        log.debug("Wrote {} bytes to {}", bytes.length, locator);
    }

    @Override
    public byte[] read(String locator) {
        String key = keyOf(locator);
        try {
            return s3.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build()).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new ArtifactReadFailedException("Artifact not found in S3: " + locator, e);
        } catch (SdkException e) {
            throw new ArtifactReadFailedException("Failed to read artifact from S3: " + locator, e);
        }
    }

    @Override
    public boolean exists(String locator) {
        try {
            s3.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(keyOf(locator))
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public void deleteVersion(String modelName, String version) {
        String versionPrefix = versionPrefix(modelName, version) + "/";
        try {
            List<String> keys = listKeys(versionPrefix);
            for (int i = 0; i < keys.size(); i += 1000) {
                List<String> slice = keys.subList(i, Math.min(i + 1000, keys.size()));
                DeleteObjectsResponse resp = s3.deleteObjects(DeleteObjectsRequest.builder()
                        .bucket(bucket)
                        .delete(Delete.builder()
                                .objects(slice.stream()
                                        .map(k -> ObjectIdentifier.builder().key(k).build())
                                        .toList())
                                .build())
                        .build());
                if (resp.hasErrors() && !resp.errors().isEmpty()) {
                    throw new ArtifactDeleteFailedException("S3 refused to delete " + resp.errors().size()
                            + " object(s) under s3://" + bucket + "/" + versionPrefix
                            + ": " + resp.errors().get(0).message());
                }
            }
        } catch (SdkException e) {
            throw new ArtifactDeleteFailedException("Failed to delete s3://" + bucket + "/" + versionPrefix, e);
        }
        log.debug("Deleted s3://{}/{}", bucket, versionPrefix);
    }

    private List<String> listKeys(String keyPrefix) {
        List<String> out = new ArrayList<>();
        String token = null;
        ListObjectsV2Response resp;
        do {
            resp = s3.listObjectsV2(ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(keyPrefix)
                    .continuationToken(token)
                    .build());
            resp.contents().stream().map(S3Object::key).forEach(out::add);
            token = resp.nextContinuationToken();
        } while (Boolean.TRUE.equals(resp.isTruncated()));
        return out;
    }

    private String versionPrefix(String modelName, String version) {
        return ArtifactKeyUtil.join(prefix, ArtifactKeyUtil.versionPrefix(modelName, version));
    }

    private String keyOf(String locator) {
        if (!bucket.equals(ArtifactKeyUtil.bucketOf(locator))) {
            throw new IllegalArgumentException("Locator " + locator + " is not in bucket " + bucket);
        }
        return ArtifactKeyUtil.keyOf(locator);
    }
}
