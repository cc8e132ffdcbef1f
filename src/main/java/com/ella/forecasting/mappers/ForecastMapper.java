package com.ella.forecasting.mappers;

import java.time.LocalDate;
import java.util.ArrayList;

import com.ella.forecasting.dto.forecast.ForecastAlertDTO;
import com.ella.forecasting.dto.forecast.ForecastResponseDTO;
import com.ella.forecasting.entities.Forecast;
import com.ella.forecasting.entities.ForecastAlert;

public class ForecastMapper {

    private ForecastMapper() {}

    public static ForecastResponseDTO toResponseDTO(Forecast entity, LocalDate today) {
        return ForecastResponseDTO.builder()
                .id(entity.getId())
                .userId(entity.getUserId())
                .forecastPeriod(entity.getForecastPeriod())
                .category(entity.getCategory())
                .predictions(new ArrayList<>(entity.getPredictions()))
                .aggregateForecast(entity.getAggregateForecast())
                .seasonalFactors(new ArrayList<>(entity.getSeasonalFactors()))
                .modelMetadata(entity.getModelMetadata())
                .vsBudget(entity.getComparison())
                .alerts(new ArrayList<>(entity.getAlerts()))
                .recommendations(new ArrayList<>(entity.getRecommendations()))
                .accuracyTracking(new ArrayList<>(entity.getAccuracyTracking()))
                .status(entity.getStatus())
                .forecastAccuracy(entity.getForecastAccuracy())
                .daysRemaining(entity.daysRemaining(today))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public static ForecastAlertDTO toAlertDTO(Forecast forecast, ForecastAlert alert) {
        return new ForecastAlertDTO(
                forecast.getId(),
                forecast.getCategory(),
                alert.getAlertId(),
                alert.getAlertType(),
                alert.getSeverity(),
                alert.getMessage(),
                alert.getTriggeredAt(),
                alert.isAcknowledged()
        );
    }
}
