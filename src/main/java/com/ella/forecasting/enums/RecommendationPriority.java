package com.ella.forecasting.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    RecommendationPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
