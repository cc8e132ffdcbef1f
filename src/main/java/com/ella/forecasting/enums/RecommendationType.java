package com.ella.forecasting.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationType {
    INCREASE_BUDGET("increase_budget"),
    DECREASE_BUDGET("decrease_budget"),
    ADJUST_SPENDING("adjust_spending"),
    SAVE_MORE("save_more"),
    REVIEW_CATEGORY("review_category");

    private final String value;

    RecommendationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
