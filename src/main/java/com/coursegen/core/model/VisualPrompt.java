package com.coursegen.core.model;

import java.io.Serializable;

/**
 * An image to render for one visual tag of a lesson.
 *
 * @param imageId     run-unique numeric id derived from the lesson's outline position
 * @param targetRef   the lesson the tag belongs to
 * @param description the tag text as written in the lesson
 * @param prompt      the expanded prompt sent to the image model
 */
public record VisualPrompt(int imageId, String targetRef, String description, String prompt)
        implements Serializable {}
