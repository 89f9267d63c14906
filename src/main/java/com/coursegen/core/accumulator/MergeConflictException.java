package com.coursegen.core.accumulator;

import com.coursegen.core.model.ImageBinding;

/**
 * Raised when a unit tries to bind an image id that already holds a different binding.
 * Never retried; it means two units disagree about the same artifact.
 */
public class MergeConflictException extends RuntimeException {

    private final int imageId;
    private final ImageBinding existing;
    private final ImageBinding incoming;

    public MergeConflictException(int imageId, ImageBinding existing, ImageBinding incoming) {
        super("Image " + imageId + " is already bound to " + existing.storageKey()
                + ", refusing " + incoming.storageKey());
        this.imageId = imageId;
        this.existing = existing;
        this.incoming = incoming;
    }

    public int imageId() {
        return imageId;
    }

    public ImageBinding existing() {
        return existing;
    }

    public ImageBinding incoming() {
        return incoming;
    }
}
