package com.coursegen.core.model;

import java.util.Locale;

/**
 * Ordered steps of the generation pipeline.
 */
public enum StageName {
    CONTENT("content"),
    VISUAL_PLAN("visual-plan"),
    IMAGE_RENDER("image-render"),
    LAB_PLAN("lab-plan"),
    LAB_WRITE("lab-write"),
    ASSEMBLY("assembly");

    private final String configKey;

    StageName(String configKey) {
        this.configKey = configKey;
    }

    /** Key used for per-stage configuration overrides. */
    public String configKey() {
        return configKey;
    }

    /**
     * Resolves a config key ({@code image-render}) or enum name ({@code IMAGE_RENDER}).
     */
    public static StageName fromConfigKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (StageName stage : values()) {
            if (stage.configKey.equals(normalized)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage '" + key + "'");
    }
}
