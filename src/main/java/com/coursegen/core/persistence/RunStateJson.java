package com.coursegen.core.persistence;

import com.coursegen.core.model.RunState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON form of {@link RunState} shared by the stores.
 */
final class RunStateJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private RunStateJson() {}

    static String write(RunState state) {
        try {
            return MAPPER.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run state " + state.runId(), e);
        }
    }

    static RunState read(String json) {
        try {
            return MAPPER.readValue(json, RunState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize run state", e);
        }
    }
}
