package com.coursegen.core.storage;

/**
 * Thrown when the artifact store cannot read or write a key.
 */
public class ArtifactStoreException extends RuntimeException {

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
