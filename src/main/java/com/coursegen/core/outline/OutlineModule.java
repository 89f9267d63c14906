package com.coursegen.core.outline;

import java.io.Serializable;
import java.util.List;

public record OutlineModule(
    int number,
    String title,
    String description,
    int durationMinutes,
    String bloomLevel,
    List<OutlineLesson> lessons,
    List<OutlineLab> labs
) implements Serializable {

    public OutlineModule {
        lessons = lessons == null ? List.of() : List.copyOf(lessons);
        labs = labs == null ? List.of() : List.copyOf(labs);
        description = description == null ? "" : description;
    }
}
