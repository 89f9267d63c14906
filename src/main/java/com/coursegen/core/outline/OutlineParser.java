package com.coursegen.core.outline;

import com.coursegen.core.storage.ArtifactStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Reads a YAML course outline into a {@link CourseOutline}.
 * <p>
 * Accepts the two shapes outlines come in: modules under {@code course.modules} or a
 * top-level {@code modules} key, and course info under {@code course} or
 * {@code course_metadata}. Labs are normalized from either lesson-level
 * {@code lab_activities} or module-level {@code labs}/{@code lab_activities}; a lab may be a
 * mapping or a plain title string.
 */
@Component
public class OutlineParser {

    private static final Logger log = LoggerFactory.getLogger(OutlineParser.class);

    static final int DEFAULT_LESSON_MINUTES = 45;
    static final int DEFAULT_LAB_MINUTES = 30;

    private final ArtifactStore artifactStore;
    private final ObjectMapper yamlMapper;

    public OutlineParser(ArtifactStore artifactStore) {
        this.artifactStore = artifactStore;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Loads and parses the outline stored under {@code outlineRef}.
     *
     * @throws StructuralValidationException if the outline is missing or unusable
     */
    public CourseOutline load(String outlineRef) {
        if (outlineRef == null || outlineRef.isBlank()) {
            throw new StructuralValidationException("An outline reference is required");
        }
        String yaml = artifactStore.getText(outlineRef)
                .orElseThrow(() -> new StructuralValidationException("Outline not found: " + outlineRef));
        var outline = parse(yaml);
        log.info("Loaded outline '{}' from {}: {} modules, {} lessons, {} labs",
                outline.title(), outlineRef, outline.modules().size(),
                outline.lessons().size(), outline.labs().size());
        return outline;
    }

    public CourseOutline parse(String yaml) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(yaml == null ? "" : yaml);
        } catch (JsonProcessingException e) {
            throw new StructuralValidationException("Outline is not valid YAML: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject() || root.isEmpty()) {
            throw new StructuralValidationException("Outline document is empty");
        }

        JsonNode course = root.path("course");
        JsonNode modulesNode = course.path("modules").isArray() ? course.path("modules") : root.path("modules");
        JsonNode info = course.isObject() ? course : root.path("course_metadata");
        if (!modulesNode.isArray() || modulesNode.isEmpty()) {
            throw new StructuralValidationException(
                    "Outline has no modules (expected 'course.modules' or 'modules')");
        }

        var warnings = new ArrayList<String>();
        var modules = new ArrayList<OutlineModule>();
        int number = 1;
        for (JsonNode moduleNode : modulesNode) {
            modules.add(parseModule(moduleNode, number++, warnings));
        }
        return new CourseOutline(text(info, "title", "Course"), text(info, "description", ""),
                modules, warnings);
    }

    private OutlineModule parseModule(JsonNode node, int moduleNumber, List<String> warnings) {
        String title = text(node, "title", "Module " + moduleNumber);
        int duration = node.path("duration_minutes").asInt(DEFAULT_LESSON_MINUTES);
        String bloom = text(node, "bloom_level", "Understand");

        var lessons = new ArrayList<OutlineLesson>();
        var lessonLabs = new ArrayList<OutlineLab>();
        var allTopics = new ArrayList<String>();
        int lessonNumber = 1;
        for (JsonNode lessonNode : node.path("lessons")) {
            String lessonTitle = text(lessonNode, "title", "Lesson " + lessonNumber);
            String lessonBloom = text(lessonNode, "bloom_level", bloom);
            var topics = topics(lessonNode.path("topics"));
            allTopics.addAll(topics);

            JsonNode labNodes = lessonNode.path("lab_activities");
            int labNumber = 1;
            for (JsonNode labNode : labNodes) {
                lessonLabs.add(parseLab(labNode, moduleNumber, lessonNumber, labNumber++, lessonBloom, topics));
            }

            lessons.add(new OutlineLesson(
                    OutlineRefs.lesson(moduleNumber, lessonNumber), moduleNumber, lessonNumber,
                    lessonTitle, lessonNode.path("duration_minutes").asInt(duration), lessonBloom,
                    topics, labNodes.size()));
            lessonNumber++;
        }

        JsonNode moduleLabNodes = node.path("labs").isArray() && !node.path("labs").isEmpty()
                ? node.path("labs") : node.path("lab_activities");
        var moduleLabs = new ArrayList<OutlineLab>();
        var usedNumbers = new HashSet<Integer>();
        int index = 1;
        for (JsonNode labNode : moduleLabNodes) {
            int labNumber = labNode.isObject() ? labNode.path("number").asInt(index) : index;
            if (!usedNumbers.add(labNumber)) {
                int renumbered = labNumber;
                while (!usedNumbers.add(renumbered)) {
                    renumbered++;
                }
                warnings.add(String.format("Module %d lab number %d is declared twice; renumbered to %d",
                        moduleNumber, labNumber, renumbered));
                labNumber = renumbered;
            }
            moduleLabs.add(parseLab(labNode, moduleNumber, 0, labNumber, text(node, "bloom_level", "Apply"), allTopics));
            index++;
        }

        List<OutlineLab> labs;
        if (!lessonLabs.isEmpty() && !moduleLabs.isEmpty()) {
            String warning = String.format(
                    "Module %d declares labs at both lesson level (%d) and module level (%d); using lesson-level labs",
                    moduleNumber, lessonLabs.size(), moduleLabs.size());
            log.warn(warning);
            warnings.add(warning);
            labs = lessonLabs;
        } else {
            labs = lessonLabs.isEmpty() ? moduleLabs : lessonLabs;
        }

        return new OutlineModule(moduleNumber, title, text(node, "description", ""), duration, bloom,
                lessons, labs);
    }

    private OutlineLab parseLab(JsonNode node, int moduleNumber, int lessonNumber, int labNumber,
                                String inheritedBloom, List<String> contextTopics) {
        String labId = OutlineRefs.lab(moduleNumber, lessonNumber, labNumber);
        if (!node.isObject()) {
            return new OutlineLab(labId, moduleNumber, lessonNumber, node.asText("Lab " + labNumber),
                    DEFAULT_LAB_MINUTES, inheritedBloom, List.of(), List.of(), "", contextTopics);
        }
        return new OutlineLab(labId, moduleNumber, lessonNumber,
                text(node, "title", "Lab " + labNumber),
                node.path("duration_minutes").asInt(DEFAULT_LAB_MINUTES),
                text(node, "bloom_level", inheritedBloom),
                strings(node.path("objectives")),
                strings(node.path("activities")),
                text(node, "description", ""),
                contextTopics);
    }

    private static List<String> topics(JsonNode node) {
        var topics = new ArrayList<String>();
        for (JsonNode topic : node) {
            String value = topic.isObject() ? text(topic, "title", "") : topic.asText("");
            if (!value.isBlank()) {
                topics.add(value);
            }
        }
        return topics;
    }

    private static List<String> strings(JsonNode node) {
        var values = new ArrayList<String>();
        for (JsonNode item : node) {
            String value = item.isObject() ? text(item, "title", item.toString()) : item.asText("");
            if (!value.isBlank()) {
                values.add(value);
            }
        }
        return values;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.path(field);
        if (value.isValueNode() && !value.isNull()) {
            String text = value.asText();
            return text.isBlank() ? fallback : text.trim();
        }
        return fallback;
    }
}
