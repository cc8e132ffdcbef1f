package com.ella.forecasting.services.forecasting.models;

import java.util.List;

import com.ella.forecasting.entities.Prediction;

public record ForecastModelResult(
        List<Prediction> predictions,
        double accuracyScore,
        double rmse,
        double mae
) {
}
