package com.coursegen.core.model;

import java.io.Serializable;
import java.util.List;

public record UnitFailure(
    String unitId,
    List<String> targetRefs,
    StageName stage,
    ErrorClass errorClass,
    String message
) implements Serializable {}
