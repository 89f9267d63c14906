package com.coursegen.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One generated lesson or lab, keyed by its outline ref.
 *
 * @param targetRef  lesson ref ({@code MM-LL}) or lab id ({@code MM-LL-NN})
 * @param kind       what was generated
 * @param title      outline title
 * @param storageKey where the markdown was written
 * @param text       generated markdown, including {@code [VISUAL: ...]} tags for lessons
 * @param imageIds   ids of the images bound to this entry's visual tags, in tag order
 */
public record ContentEntry(
    String targetRef,
    ContentKind kind,
    String title,
    String storageKey,
    String text,
    List<Integer> imageIds
) implements Serializable {

    public ContentEntry {
        imageIds = imageIds == null ? List.of() : List.copyOf(imageIds);
    }

    public ContentEntry withImageIds(List<Integer> ids) {
        return new ContentEntry(targetRef, kind, title, storageKey, text, ids);
    }
}
