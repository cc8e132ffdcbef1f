package com.ella.forecasting.services.forecasting.models;

import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Component;

import com.ella.forecasting.config.ForecastingProperties;
import com.ella.forecasting.entities.Prediction;
import com.ella.forecasting.enums.ForecastAlgorithm;
import com.ella.forecasting.services.forecasting.ForecastMath;
import com.ella.forecasting.services.forecasting.HistoricalPoint;

import lombok.RequiredArgsConstructor;

/**
 * Simple exponential smoothing. The last smoothed level is repeated for every future month; no
 * trend component.
 */
@Component
@RequiredArgsConstructor
public class ExponentialSmoothingForecastModel implements ForecastModel {

    private final ForecastingProperties properties;

    @Override
    public ForecastAlgorithm algorithm() {
        return ForecastAlgorithm.EXPONENTIAL_SMOOTHING;
    }

    @Override
    public ForecastModelResult fit(List<HistoricalPoint> history, List<LocalDate> predictionDates, int confidenceLevel) {
        double alpha = properties.smoothingAlpha();
        double[] y = ForecastMath.amounts(history);

        double[] smoothed = new double[y.length];
        smoothed[0] = y[0];
        for (int i = 1; i < y.length; i++) {
            smoothed[i] = alpha * y[i] + (1 - alpha) * smoothed[i - 1];
        }

        double[] residuals = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            residuals[i] = y[i] - smoothed[i];
        }
        double stdDev = ForecastMath.rmse(residuals);
        double margin = ForecastMath.finite(properties.confidenceZScore() * stdDev);
        double level = smoothed[smoothed.length - 1];

        List<Prediction> predictions = predictionDates.stream()
                .map(date -> Prediction.builder()
                        .date(date)
                        .predictedAmount(level)
                        .confidenceLower(Math.min(level, Math.max(0.0, level - margin)))
                        .confidenceUpper(level + margin)
                        .confidenceLevel(confidenceLevel)
                        .build())
                .toList();

        double mae = ForecastMath.mae(residuals);
        return new ForecastModelResult(
                predictions,
                ForecastMath.accuracyScore(mae, ForecastMath.mean(y)),
                stdDev,
                mae
        );
    }
}
