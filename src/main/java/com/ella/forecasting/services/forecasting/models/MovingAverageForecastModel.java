package com.ella.forecasting.services.forecasting.models;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import org.springframework.stereotype.Component;

import com.ella.forecasting.config.ForecastingProperties;
import com.ella.forecasting.entities.Prediction;
import com.ella.forecasting.enums.ForecastAlgorithm;
import com.ella.forecasting.services.forecasting.ForecastMath;
import com.ella.forecasting.services.forecasting.HistoricalPoint;

import lombok.RequiredArgsConstructor;

/**
 * Flat forecast at the average of the most recent months.
 */
@Component
@RequiredArgsConstructor
public class MovingAverageForecastModel implements ForecastModel {

    private final ForecastingProperties properties;

    @Override
    public ForecastAlgorithm algorithm() {
        return ForecastAlgorithm.MOVING_AVERAGE;
    }

    @Override
    public ForecastModelResult fit(List<HistoricalPoint> history, List<LocalDate> predictionDates, int confidenceLevel) {
        double[] amounts = ForecastMath.amounts(history);
        int windowSize = Math.min(properties.movingAverageWindow(), amounts.length);
        double[] recent = Arrays.copyOfRange(amounts, amounts.length - windowSize, amounts.length);

        double average = ForecastMath.mean(recent);
        double stdDev = ForecastMath.populationStdDev(recent, average);
        double margin = ForecastMath.finite(properties.confidenceZScore() * stdDev);

        List<Prediction> predictions = predictionDates.stream()
                .map(date -> Prediction.builder()
                        .date(date)
                        .predictedAmount(average)
                        .confidenceLower(average - margin)
                        .confidenceUpper(average + margin)
                        .confidenceLevel(confidenceLevel)
                        .build())
                .toList();

        double[] residuals = Arrays.stream(recent).map(v -> v - average).toArray();
        double mae = ForecastMath.mae(residuals);

        return new ForecastModelResult(
                predictions,
                ForecastMath.accuracyScore(mae, average),
                ForecastMath.rmse(residuals),
                mae
        );
    }
}
