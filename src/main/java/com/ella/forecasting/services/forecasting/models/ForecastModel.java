package com.ella.forecasting.services.forecasting.models;

import java.time.LocalDate;
import java.util.List;

import com.ella.forecasting.enums.ForecastAlgorithm;
import com.ella.forecasting.services.forecasting.HistoricalPoint;

public interface ForecastModel {

    ForecastAlgorithm algorithm();

    /**
     * Fits the model to the monthly history (ascending, at least one point) and predicts one amount
     * per date. The confidence level is carried on each prediction; bands always use the configured
     * z-score.
     */
    ForecastModelResult fit(List<HistoricalPoint> history, List<LocalDate> predictionDates, int confidenceLevel);
}
