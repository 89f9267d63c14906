package com.coursegen.core.outline;

import java.io.Serializable;
import java.util.List;

/**
 * A lab activity in its normalized form, whichever outline key it was declared under.
 * {@code lessonNumber} is 0 for module-level labs.
 */
public record OutlineLab(
    String labId,
    int moduleNumber,
    int lessonNumber,
    String title,
    int durationMinutes,
    String bloomLevel,
    List<String> objectives,
    List<String> activities,
    String description,
    List<String> contextTopics
) implements Serializable {

    public OutlineLab {
        objectives = objectives == null ? List.of() : List.copyOf(objectives);
        activities = activities == null ? List.of() : List.copyOf(activities);
        contextTopics = contextTopics == null ? List.of() : List.copyOf(contextTopics);
        description = description == null ? "" : description;
    }
}
