package com.coursegen.core.outline;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Normalized course outline: modules in outline order, each with its lessons and labs.
 *
 * @param title       course title
 * @param description course description
 * @param modules     modules in outline order
 * @param warnings    non-fatal issues found while normalizing (e.g. ambiguous lab placement)
 */
public record CourseOutline(
    String title,
    String description,
    List<OutlineModule> modules,
    List<String> warnings
) implements Serializable {

    public CourseOutline {
        modules = modules == null ? List.of() : List.copyOf(modules);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        description = description == null ? "" : description;
    }

    public List<OutlineLesson> lessons() {
        return modules.stream().flatMap(m -> m.lessons().stream()).toList();
    }

    public List<OutlineLab> labs() {
        return modules.stream().flatMap(m -> m.labs().stream()).toList();
    }

    public Optional<OutlineModule> module(int number) {
        return modules.stream().filter(m -> m.number() == number).findFirst();
    }

    public Optional<OutlineLesson> findLesson(String ref) {
        return lessons().stream().filter(l -> l.ref().equals(ref)).findFirst();
    }

    public Optional<OutlineLab> findLab(String labId) {
        return labs().stream().filter(l -> l.labId().equals(labId)).findFirst();
    }

    /**
     * Every lesson ref and lab id in reading order: per module, lessons first then labs.
     */
    public List<String> orderedRefs() {
        var refs = new ArrayList<String>();
        for (var module : modules) {
            module.lessons().forEach(l -> refs.add(l.ref()));
            module.labs().forEach(l -> refs.add(l.labId()));
        }
        return refs;
    }
}
