package com.coursegen.core.storage;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Deterministic storage keys for generated artifacts. The same ref always maps to the
 * same key, so a retried write replaces rather than duplicates.
 */
public final class StorageKeys {

    private StorageKeys() {}

    /**
     * Lesson key for one artifact revision. Regeneration passes write into their own
     * revision directory, so the file a committed entry points to is never overwritten
     * by a pass that later fails.
     */
    public static String lesson(String folder, int revision, int module, int lesson, String title) {
        return section(folder, "lessons", revision) + "module-" + module + "-lesson-" + lesson + "-" + slug(title) + ".md";
    }

    public static String labGuide(String folder, int revision, String labId) {
        return section(folder, "labguide", revision) + "lab-" + labId + ".md";
    }

    public static String labPlan(String folder, int revision, String labId) {
        return section(folder, "labguide/plans", revision) + "lab-" + labId + "-plan.md";
    }

    public static String image(String folder, int revision, int imageId) {
        return section(folder, "images", revision) + imageId + ".png";
    }

    public static String book(String folder) {
        return folder + "/book/course-book.md";
    }

    public static String runState(String runId) {
        return "runs/" + runId + "/run-state.json";
    }

    private static String section(String folder, String section, int revision) {
        return revision == 0 ? folder + "/" + section + "/" : folder + "/" + section + "/rev-" + revision + "/";
    }

    static String slug(String title) {
        if (title == null || title.isBlank()) {
            return "untitled";
        }
        String ascii = Normalizer.normalize(title, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        String slug = ascii.replaceAll("[^A-Za-z0-9\\s]", "").trim().replaceAll("\\s+", "-");
        return slug.isEmpty() ? "untitled" : slug.toLowerCase(Locale.ROOT);
    }
}
