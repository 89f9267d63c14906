package com.coursegen.core.model;

import java.io.Serializable;

/**
 * Compact reference to a rendered image. Kept small on purpose: the run artifact
 * carries one of these per image.
 */
public record ImageBinding(String storageKey, String description) implements Serializable {}
