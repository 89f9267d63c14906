package com.coursegen.core.storage;

import java.util.Optional;

/**
 * Object store for outlines, generated markdown, images and run artifacts.
 * Keys are slash-separated paths. Writes to an existing key overwrite it.
 */
public interface ArtifactStore {

    void put(String key, byte[] content);

    Optional<byte[]> get(String key);

    boolean exists(String key);

    default void putText(String key, String text) {
        put(key, text.getBytes(java.nio.charset.StandardCharsets.UTF_8));
    }

    default Optional<String> getText(String key) {
        return get(key).map(bytes -> new String(bytes, java.nio.charset.StandardCharsets.UTF_8));
    }
}
