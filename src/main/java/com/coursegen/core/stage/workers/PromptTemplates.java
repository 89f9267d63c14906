package com.coursegen.core.stage.workers;

import com.coursegen.core.generation.GenerationPrompt;
import com.coursegen.core.model.GenerationContext;
import com.coursegen.core.model.StageName;
import com.coursegen.core.outline.CourseOutline;
import com.coursegen.core.outline.OutlineLab;
import com.coursegen.core.outline.OutlineLesson;
import com.coursegen.core.outline.OutlineModule;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prompt text for the generation stages.
 */
final class PromptTemplates {

    static final String RULE = "═".repeat(72);

    private static final List<String> BLOOM_ORDER =
            List.of("remember", "understand", "apply", "analyze", "evaluate", "create");
    private static final Map<String, Double> BLOOM_MULTIPLIERS = Map.of(
            "remember", 1.0, "understand", 1.1, "apply", 1.2,
            "analyze", 1.3, "evaluate", 1.4, "create", 1.5);
    private static final double DEFAULT_BLOOM_MULTIPLIER = 1.1;

    static final int WORDS_PER_MINUTE = 15;
    static final int WORDS_PER_TOPIC = 80;
    static final int WORDS_PER_LAB = 120;
    static final int MIN_WORDS = 500;
    static final int MAX_WORDS = 3000;

    static final String LESSON_SYSTEM = """
            You are an expert technical educator writing lesson content for a professional course.
            Write in clear markdown. Start with a heading "# Lesson N: Title".
            Where a diagram or illustration would help, insert a tag of the form
            [VISUAL: short description of the visual] on its own line.
            Stay within the lesson's topics and never contradict the course outline.
            """;

    static final String VISUAL_SYSTEM = """
            You write prompts for an image model that produces clean, professional course illustrations.
            Return one paragraph describing composition, style and labels. No markdown.
            """;

    static final String LAB_PLAN_SYSTEM = """
            You are an instructional designer planning hands-on lab exercises.
            Produce a markdown plan with sections: Objectives, Prerequisites, Steps, Validation.
            """;

    static final String LAB_GUIDE_SYSTEM = """
            You are an expert technical instructor writing a step-by-step lab guide in markdown.
            Follow the plan exactly. Every step needs a command or action and an expected result.
            """;

    private PromptTemplates() {}

    /**
     * Target length for a lesson: {@value #WORDS_PER_MINUTE} words per minute scaled by the
     * Bloom level, plus allowances per topic and per lab, clamped to [{@value #MIN_WORDS}, {@value #MAX_WORDS}].
     */
    static int targetWords(OutlineLesson lesson) {
        int base = (int) (lesson.durationMinutes() * WORDS_PER_MINUTE * bloomMultiplier(lesson.bloomLevel()));
        int total = base + lesson.topics().size() * WORDS_PER_TOPIC + lesson.labCount() * WORDS_PER_LAB;
        return Math.max(MIN_WORDS, Math.min(MAX_WORDS, total));
    }

    /**
     * Compound levels such as {@code "Apply/Analyze"} use the highest listed level.
     */
    static double bloomMultiplier(String bloomLevel) {
        if (bloomLevel == null || bloomLevel.isBlank()) {
            return DEFAULT_BLOOM_MULTIPLIER;
        }
        String highest = null;
        for (String part : bloomLevel.split("/")) {
            String level = part.trim().toLowerCase(Locale.ROOT);
            if (BLOOM_ORDER.contains(level)
                    && (highest == null || BLOOM_ORDER.indexOf(level) > BLOOM_ORDER.indexOf(highest))) {
                highest = level;
            }
        }
        return highest == null ? DEFAULT_BLOOM_MULTIPLIER : BLOOM_MULTIPLIERS.get(highest);
    }

    static String courseContext(CourseOutline outline) {
        var sb = new StringBuilder();
        sb.append(RULE).append('\n')
          .append("COMPLETE COURSE OUTLINE\n")
          .append(RULE).append('\n')
          .append("Course: ").append(outline.title()).append('\n')
          .append("Total Modules: ").append(outline.modules().size()).append("\n\n");
        for (OutlineModule module : outline.modules()) {
            sb.append("MODULE ").append(module.number()).append(": ").append(module.title()).append('\n');
            for (OutlineLesson lesson : module.lessons()) {
                sb.append("  Lesson ").append(module.number()).append('.').append(lesson.lessonNumber())
                  .append(": ").append(lesson.title()).append('\n');
            }
        }
        sb.append(RULE);
        return sb.toString();
    }

    static String lesson(CourseOutline outline, OutlineModule module, OutlineLesson lesson,
                         Map<String, String> overrides) {
        var sb = new StringBuilder();
        sb.append(courseContext(outline)).append("\n\n")
          .append("MODULE ").append(module.number()).append(": ").append(module.title()).append('\n')
          .append("Description: ").append(module.description()).append("\n\n")
          .append("Write Lesson ").append(lesson.lessonNumber()).append(": ").append(lesson.title()).append('\n')
          .append("Duration: ").append(lesson.durationMinutes()).append(" minutes\n")
          .append("Bloom Level: ").append(lesson.bloomLevel()).append('\n')
          .append("Target Length: ~").append(targetWords(lesson)).append(" words\n")
          .append("Topics:\n");
        if (lesson.topics().isEmpty()) {
            sb.append("  (None specified)\n");
        }
        lesson.topics().forEach(t -> sb.append("  - ").append(t).append('\n'));
        appendOverrides(sb, overrides);
        return sb.toString();
    }

    static String visual(OutlineLesson lesson, String description) {
        return "Lesson: " + lesson.title() + "\nIllustration needed: " + description;
    }

    static String labPlan(CourseOutline outline, OutlineLab lab, Map<String, String> overrides) {
        var sb = new StringBuilder();
        sb.append("Course: ").append(outline.title()).append('\n')
          .append("Lab ").append(lab.labId()).append(": ").append(lab.title()).append('\n')
          .append("Duration: ").append(lab.durationMinutes()).append(" minutes\n")
          .append("Bloom Level: ").append(lab.bloomLevel()).append('\n');
        if (!lab.description().isBlank()) {
            sb.append("Description: ").append(lab.description()).append('\n');
        }
        appendList(sb, "Objectives", lab.objectives());
        appendList(sb, "Activities", lab.activities());
        appendList(sb, "Related topics", lab.contextTopics());
        appendOverrides(sb, overrides);
        return sb.toString();
    }

    static String labGuide(OutlineLab lab, String plan, Map<String, String> overrides) {
        var sb = new StringBuilder();
        sb.append("Lab ").append(lab.labId()).append(": ").append(lab.title()).append('\n')
          .append("Duration: ").append(lab.durationMinutes()).append(" minutes\n\n")
          .append("PLAN\n").append(RULE).append('\n').append(plan).append('\n').append(RULE).append('\n');
        appendOverrides(sb, overrides);
        return sb.toString();
    }

    static Map<String, String> constraints(StageName stage, String targetRef, GenerationContext context) {
        String provider = context == null || context.modelProvider() == null ? "" : context.modelProvider();
        return Map.of(GenerationPrompt.STAGE, stage.configKey(),
                GenerationPrompt.TARGET_REF, targetRef,
                GenerationPrompt.PROVIDER, provider);
    }

    private static void appendList(StringBuilder sb, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append(heading).append(":\n");
        items.forEach(i -> sb.append("  - ").append(i).append('\n'));
    }

    private static void appendOverrides(StringBuilder sb, Map<String, String> overrides) {
        if (overrides.isEmpty()) {
            return;
        }
        sb.append("\nADDITIONAL REQUIREMENTS:\n");
        overrides.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n'));
    }
}
