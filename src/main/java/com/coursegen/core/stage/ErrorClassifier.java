package com.coursegen.core.stage;

import com.coursegen.core.model.ErrorClass;

/**
 * Maps a stage failure onto the error taxonomy that drives retry and fail-fast.
 */
@FunctionalInterface
public interface ErrorClassifier {

    ErrorClass classify(Throwable error);
}
