package com.ella.forecasting.services.forecasting;

import java.util.List;

import org.springframework.stereotype.Component;

import com.ella.forecasting.entities.AggregateForecast;
import com.ella.forecasting.entities.Prediction;
import com.ella.forecasting.enums.ForecastTrend;

@Component
public class AggregateForecastCalculator {

    private static final double TREND_THRESHOLD = 10.0;
    private static final double STABLE_THRESHOLD = 5.0;

    public AggregateForecast calculate(List<Prediction> predictions, List<HistoricalPoint> history) {
        double totalPredicted = predictions.stream()
                .mapToDouble(Prediction::getPredictedAmount)
                .sum();
        double averageMonthly = predictions.isEmpty() ? 0.0 : totalPredicted / predictions.size();

        double historicalAverage = ForecastMath.mean(ForecastMath.amounts(history));
        double trendPercentage = historicalAverage == 0.0
                ? 0.0
                : ForecastMath.finite((averageMonthly - historicalAverage) / historicalAverage * 100.0);

        return AggregateForecast.builder()
                .totalPredicted(totalPredicted)
                .averageMonthly(averageMonthly)
                .trend(classifyTrend(trendPercentage))
                .trendPercentage(trendPercentage)
                .build();
    }

    /**
     * Precedence: increasing, decreasing, stable, volatile. Exactly +10 / -10 count as
     * increasing / decreasing.
     */
    public static ForecastTrend classifyTrend(double trendPercentage) {
        if (trendPercentage >= TREND_THRESHOLD) return ForecastTrend.INCREASING;
        if (trendPercentage <= -TREND_THRESHOLD) return ForecastTrend.DECREASING;
        if (Math.abs(trendPercentage) < STABLE_THRESHOLD) return ForecastTrend.STABLE;
        return ForecastTrend.VOLATILE;
    }
}
