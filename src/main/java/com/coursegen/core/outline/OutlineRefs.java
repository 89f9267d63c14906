package com.coursegen.core.outline;

import java.util.regex.Pattern;

/**
 * Formatting and recognition of outline refs.
 * Lessons are {@code MM-LL}; labs are {@code MM-LL-NN}, with {@code LL = 00} for module-level labs.
 */
public final class OutlineRefs {

    private static final Pattern LESSON_REF = Pattern.compile("\\d{2}-\\d{2}");
    private static final Pattern LAB_REF = Pattern.compile("\\d{2}-\\d{2}-\\d{2}");

    private OutlineRefs() {}

    public static String lesson(int module, int lesson) {
        return String.format("%02d-%02d", module, lesson);
    }

    public static String lab(int module, int lesson, int lab) {
        return String.format("%02d-%02d-%02d", module, lesson, lab);
    }

    public static boolean isLessonRef(String ref) {
        return ref != null && LESSON_REF.matcher(ref).matches();
    }

    public static boolean isLabRef(String ref) {
        return ref != null && LAB_REF.matcher(ref).matches();
    }

    public static int moduleOf(String ref) {
        return Integer.parseInt(ref.substring(0, 2));
    }

    public static int lessonOf(String ref) {
        return Integer.parseInt(ref.substring(3, 5));
    }
}
