package com.ella.forecasting.dto.forecast;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import com.ella.forecasting.entities.AccuracyTrackingEntry;
import com.ella.forecasting.entities.AggregateForecast;
import com.ella.forecasting.entities.BudgetComparison;
import com.ella.forecasting.entities.ForecastAlert;
import com.ella.forecasting.entities.ForecastPeriod;
import com.ella.forecasting.entities.ForecastRecommendation;
import com.ella.forecasting.entities.ModelMetadata;
import com.ella.forecasting.entities.Prediction;
import com.ella.forecasting.entities.SeasonalFactor;
import com.ella.forecasting.enums.ForecastStatus;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ForecastResponseDTO {
    private UUID id;
    private UUID userId;
    private ForecastPeriod forecastPeriod;
    private String category;

    private List<Prediction> predictions;
    private AggregateForecast aggregateForecast;
    private List<SeasonalFactor> seasonalFactors;
    private ModelMetadata modelMetadata;
    private BudgetComparison vsBudget;

    private List<ForecastAlert> alerts;
    private List<ForecastRecommendation> recommendations;
    private List<AccuracyTrackingEntry> accuracyTracking;

    private ForecastStatus status;
    private Double forecastAccuracy;
    private long daysRemaining;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
