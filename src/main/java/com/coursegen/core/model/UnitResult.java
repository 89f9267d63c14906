package com.coursegen.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one work unit hands to the accumulator once its pipeline has run:
 * the committed entries, their image bindings and whether the unit's origin
 * is now fully covered.
 */
public record UnitResult(
    String unitId,
    String originUnitId,
    List<ContentEntry> entries,
    Map<Integer, ImageBinding> images,
    boolean unitFinished
) {

    public UnitResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
        images = images == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(images));
    }
}
