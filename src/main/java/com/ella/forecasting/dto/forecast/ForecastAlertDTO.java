package com.ella.forecasting.dto.forecast;

import java.time.LocalDateTime;
import java.util.UUID;

import com.ella.forecasting.enums.AlertSeverity;
import com.ella.forecasting.enums.AlertType;

public record ForecastAlertDTO(
        UUID forecastId,
        String forecastCategory,
        UUID alertId,
        AlertType alertType,
        AlertSeverity severity,
        String message,
        LocalDateTime triggeredAt,
        boolean acknowledged
) {
}
