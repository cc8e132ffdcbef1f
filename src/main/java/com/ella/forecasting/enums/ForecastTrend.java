package com.ella.forecasting.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastTrend {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable"),
    VOLATILE("volatile");

    private final String value;

    ForecastTrend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
