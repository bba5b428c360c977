package com.mesh.registry.store;

/**
 * Storage for model artifact bytes and their sidecar metadata documents.
 *
 * <p>Everything belonging to one version lives under a location derived from
 * {@code (modelName, version)}, so {@link #deleteVersion(String, String)} removes
 * the artifact and its sidecar together. Locators are opaque to callers.
 */
public interface ArtifactStore {

    /** Short name of the backend, used in logs. */
    String name();

    String artifactLocator(String modelName, String version);

    String metadataLocator(String modelName, String version);

    /**
     * Stores {@code bytes} at {@code locator}, replacing anything already there.
     *
     * @throws com.mesh.registry.exception.ArtifactWriteFailedException if the bytes could not be stored
     */
    void write(String locator, byte[] bytes);

    /**
     * @throws com.mesh.registry.exception.ArtifactReadFailedException if the locator does not resolve
     */
    byte[] read(String locator);

    boolean exists(String locator);

    /**
     * Removes every object stored for the version. Succeeds if nothing is left,
     * including when nothing was there.
     *
     * @throws com.mesh.registry.exception.ArtifactDeleteFailedException if anything could not be removed
     */
    void deleteVersion(String modelName, String version);
}
