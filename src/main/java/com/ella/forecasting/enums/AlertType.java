package com.ella.forecasting.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    FORECAST_EXCEEDS_BUDGET("forecast_exceeds_budget"),
    UNUSUAL_SPIKE("unusual_spike"),
    TREND_REVERSAL("trend_reversal"),
    SEASONAL_PEAK("seasonal_peak");

    private final String value;

    AlertType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
