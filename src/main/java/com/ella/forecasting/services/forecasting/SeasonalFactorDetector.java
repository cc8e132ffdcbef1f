package com.ella.forecasting.services.forecasting;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import com.ella.forecasting.entities.SeasonalFactor;

/**
 * Per calendar month, the ratio between that month's average spending and the overall average.
 * Descriptive only; the models never consume it.
 */
@Component
public class SeasonalFactorDetector {

    private static final double HIGH_THRESHOLD = 1.2;
    private static final double LOW_THRESHOLD = 0.8;

    public List<SeasonalFactor> detect(List<HistoricalPoint> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }

        // month -> {soma, quantidade}
        Map<Integer, double[]> byMonth = new TreeMap<>();
        for (HistoricalPoint point : history) {
            double[] acc = byMonth.computeIfAbsent(point.date().getMonthValue(), m -> new double[2]);
            acc[0] += point.amount();
            acc[1]++;
        }

        double overallAverage = ForecastMath.mean(ForecastMath.amounts(history));

        List<SeasonalFactor> factors = new ArrayList<>();
        for (Map.Entry<Integer, double[]> entry : byMonth.entrySet()) {
            double monthAverage = entry.getValue()[0] / entry.getValue()[1];
            double factor = overallAverage == 0.0 ? 1.0 : monthAverage / overallAverage;
            factors.add(SeasonalFactor.builder()
                    .month(entry.getKey())
                    .factor(factor)
                    .event(eventFor(factor))
                    .build());
        }
        return factors;
    }

    static String eventFor(double factor) {
        if (factor > HIGH_THRESHOLD) return SeasonalFactor.HIGH_SPENDING_EVENT;
        if (factor < LOW_THRESHOLD) return SeasonalFactor.LOW_SPENDING_EVENT;
        return null;
    }
}
