package com.coursegen.core.stage.workers;

import com.coursegen.core.outline.OutlineRefs;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code [VISUAL: description]} tags embedded in lesson markdown, and the image ids derived from them.
 * <p>
 * Image ids are positional: {@code module * 10000 + lesson * 100 + n} for the n-th tag (1-based)
 * of a lesson, so a retried or regenerated lesson always maps its tags onto the same ids.
 */
public final class VisualTags {

    public static final Pattern TAG = Pattern.compile("\\[VISUAL:\\s*(.+?)\\]");

    public static final int MAX_PER_LESSON = 99;

    private VisualTags() {}

    public static List<String> extract(String markdown, int limit) {
        var tags = new ArrayList<String>();
        if (markdown == null) {
            return tags;
        }
        int cap = Math.min(limit, MAX_PER_LESSON);
        Matcher m = TAG.matcher(markdown);
        while (m.find() && tags.size() < cap) {
            tags.add(m.group(1).trim());
        }
        return tags;
    }

    public static int imageId(String lessonRef, int position) {
        if (position < 1 || position > MAX_PER_LESSON) {
            throw new IllegalArgumentException("Visual position out of range: " + position);
        }
        return OutlineRefs.moduleOf(lessonRef) * 10000 + OutlineRefs.lessonOf(lessonRef) * 100 + position;
    }
}
