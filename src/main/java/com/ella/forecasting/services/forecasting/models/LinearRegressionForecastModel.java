package com.ella.forecasting.services.forecasting.models;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.ella.forecasting.config.ForecastingProperties;
import com.ella.forecasting.entities.Prediction;
import com.ella.forecasting.enums.ForecastAlgorithm;
import com.ella.forecasting.services.forecasting.ForecastMath;
import com.ella.forecasting.services.forecasting.HistoricalPoint;

import lombok.RequiredArgsConstructor;

/**
 * Ordinary least squares of the monthly amount on the month index (0..n-1), extrapolated to the
 * following indexes.
 */
@Component
@RequiredArgsConstructor
public class LinearRegressionForecastModel implements ForecastModel {

    private final ForecastingProperties properties;

    @Override
    public ForecastAlgorithm algorithm() {
        return ForecastAlgorithm.LINEAR_REGRESSION;
    }

    @Override
    public ForecastModelResult fit(List<HistoricalPoint> history, List<LocalDate> predictionDates, int confidenceLevel) {
        double[] y = ForecastMath.amounts(history);
        int n = y.length;

        double sumX = 0.0;
        double sumY = 0.0;
        double sumXY = 0.0;
        double sumX2 = 0.0;
        for (int x = 0; x < n; x++) {
            sumX += x;
            sumY += y[x];
            sumXY += x * y[x];
            sumX2 += (double) x * x;
        }

        double denominator = n * sumX2 - sumX * sumX;
        double slope = denominator == 0.0 ? 0.0 : (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;

        double[] residuals = new double[n];
        double squaredResiduals = 0.0;
        for (int x = 0; x < n; x++) {
            residuals[x] = y[x] - (slope * x + intercept);
            squaredResiduals += residuals[x] * residuals[x];
        }
        // n - 2 graus de liberdade (slope e intercept)
        double residualStdDev = Math.sqrt(squaredResiduals / Math.max(1, n - 2));
        double margin = ForecastMath.finite(properties.confidenceZScore() * residualStdDev);

        List<Prediction> predictions = new ArrayList<>(predictionDates.size());
        for (int i = 0; i < predictionDates.size(); i++) {
            double predicted = Math.max(0.0, ForecastMath.finite(slope * (n + i) + intercept));
            predictions.add(Prediction.builder()
                    .date(predictionDates.get(i))
                    .predictedAmount(predicted)
                    .confidenceLower(Math.max(0.0, predicted - margin))
                    .confidenceUpper(predicted + margin)
                    .confidenceLevel(confidenceLevel)
                    .build());
        }

        double mae = ForecastMath.mae(residuals);
        return new ForecastModelResult(
                predictions,
                ForecastMath.accuracyScore(mae, sumY / n),
                ForecastMath.rmse(residuals),
                mae
        );
    }
}
