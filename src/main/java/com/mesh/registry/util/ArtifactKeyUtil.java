package com.mesh.registry.util;

import java.util.regex.Pattern;

/** Helpers to build artifact keys and work with S3 URIs. */
public final class ArtifactKeyUtil {
    private ArtifactKeyUtil() {}

    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    /**
     * Model names and versions become path segments and object keys, so they
     * may not contain separators or start with a dot.
     */
    public static String requireSafeSegment(String value, String what) {
        if (value == null || !SAFE_SEGMENT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + value
                    + "' (letters, digits, '.', '_' and '-' only, not starting with '.', '_' or '-')");
        }
        return value;
    }

    /** Extract bucket from s3://bucket/key */
    public static String bucketOf(String s3Uri) {
        if (s3Uri == null || !s3Uri.startsWith("s3://")) {
            throw new IllegalArgumentException("Invalid S3 URI: " + s3Uri);
        }
        String trimmed = s3Uri.substring("s3://".length());
        int slash = trimmed.indexOf('/');
        return (slash < 0) ? trimmed : trimmed.substring(0, slash);
    }

    /** Extract key from s3://bucket/key (no leading slash). */
    public static String keyOf(String s3Uri) {
        if (s3Uri == null || !s3Uri.startsWith("s3://")) {
            throw new IllegalArgumentException("Invalid S3 URI: " + s3Uri);
        }
        String trimmed = s3Uri.substring("s3://".length());
        int slash = trimmed.indexOf('/');
        return (slash < 0) ? "" : trimmed.substring(slash + 1);
    }

    public static String s3Uri(String bucket, String key) {
        return "s3://" + bucket + "/" + key;
    }

    /** Joins key parts with single slashes, skipping blank parts. */
    public static String join(String... parts) {
        if (parts == null || parts.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String p : parts) {
            if (p == null || p.isBlank()) continue;
            String clean = p.trim();
            while (clean.startsWith("/")) clean = clean.substring(1);
            while (clean.endsWith("/")) clean = clean.substring(0, clean.length() - 1);
            if (!clean.isEmpty()) {
                if (sb.length() > 0) sb.append("/");
                sb.append(clean);
            }
        }
        return sb.toString();
    }

    /** {@code <modelName>/<version>} */
    public static String versionPrefix(String modelName, String version) {
        return join(requireSafeSegment(modelName, "model name"), requireSafeSegment(version, "version"));
    }
}
