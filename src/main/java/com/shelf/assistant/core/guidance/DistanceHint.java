package com.shelf.assistant.core.guidance;

import java.util.Locale;

public enum DistanceHint {
    NEAR("close"),
    FAR("a bit further");

    private final String qualifier;

    DistanceHint(String qualifier) {
        this.qualifier = qualifier;
    }

    public String getQualifier() {
        return qualifier;
    }

    /**
     * 解析视觉模型返回的距离描述
     */
    public static DistanceHint parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Distance hint is missing");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "near":
            case "close":
                return NEAR;
            case "far":
                return FAR;
            default:
                throw new IllegalArgumentException("Unknown distance hint: " + value);
        }
    }
}
