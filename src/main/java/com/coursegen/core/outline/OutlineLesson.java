package com.coursegen.core.outline;

import java.io.Serializable;
import java.util.List;

public record OutlineLesson(
    String ref,
    int moduleNumber,
    int lessonNumber,
    String title,
    int durationMinutes,
    String bloomLevel,
    List<String> topics,
    int labCount
) implements Serializable {

    public OutlineLesson {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
