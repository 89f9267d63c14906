package com.coursegen.core.assembly;

import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.ImageBinding;
import com.coursegen.core.outline.CourseOutline;

import java.util.List;
import java.util.Map;

/**
 * Builds the final course document from accumulated content.
 * Rendering is split per section so callers can stop between sections.
 */
public interface DocumentAssembler {

    String renderSection(ContentEntry entry, Map<Integer, ImageBinding> images);

    /**
     * Writes the document built from already-rendered sections and returns its storage key.
     */
    String assemble(CourseOutline outline, List<String> sections, String projectFolder);
}
