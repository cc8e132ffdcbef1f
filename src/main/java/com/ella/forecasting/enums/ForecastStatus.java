package com.ella.forecasting.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastStatus {
    ACTIVE("active"),
    ARCHIVED("archived"),
    EXPIRED("expired");

    private final String value;

    ForecastStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
