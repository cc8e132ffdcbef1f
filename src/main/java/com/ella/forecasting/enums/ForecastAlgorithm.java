package com.ella.forecasting.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastAlgorithm {
    MOVING_AVERAGE("moving_average"),
    LINEAR_REGRESSION("linear_regression"),
    EXPONENTIAL_SMOOTHING("exponential_smoothing");

    private final String value;

    ForecastAlgorithm(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ForecastAlgorithm> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(v -> v.value.equals(normalized))
                .findFirst();
    }
}
