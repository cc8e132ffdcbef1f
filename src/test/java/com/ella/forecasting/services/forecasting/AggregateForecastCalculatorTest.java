package com.ella.forecasting.services.forecasting;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.ella.forecasting.entities.AggregateForecast;
import com.ella.forecasting.entities.Prediction;
import com.ella.forecasting.enums.ForecastTrend;

class AggregateForecastCalculatorTest {

    private final AggregateForecastCalculator calculator = new AggregateForecastCalculator();

    @Test
    void calculate_sumsPredictionsAndComparesWithHistory() {
        List<Prediction> predictions = List.of(prediction(120), prediction(120), prediction(120));
        List<HistoricalPoint> history = ForecastTestData.monthly(LocalDate.of(2023, 1, 1), 100, 100, 100);

        AggregateForecast aggregate = calculator.calculate(predictions, history);

        assertEquals(360.0, aggregate.getTotalPredicted(), 1e-9);
        assertEquals(120.0, aggregate.getAverageMonthly(), 1e-9);
        assertEquals(20.0, aggregate.getTrendPercentage(), 1e-9);
        assertEquals(ForecastTrend.INCREASING, aggregate.getTrend());
    }

    @Test
    void calculate_zeroHistoricalAverage_trendIsZero() {
        AggregateForecast aggregate = calculator.calculate(
                List.of(prediction(50)),
                ForecastTestData.monthly(LocalDate.of(2023, 1, 1), 0, 0, 0));

        assertEquals(0.0, aggregate.getTrendPercentage(), 1e-9);
        assertEquals(ForecastTrend.STABLE, aggregate.getTrend());
    }

    @Test
    void classifyTrend_boundaries() {
        assertEquals(ForecastTrend.INCREASING, AggregateForecastCalculator.classifyTrend(10.0));
        assertEquals(ForecastTrend.DECREASING, AggregateForecastCalculator.classifyTrend(-10.0));
        assertEquals(ForecastTrend.STABLE, AggregateForecastCalculator.classifyTrend(4.9));
        assertEquals(ForecastTrend.STABLE, AggregateForecastCalculator.classifyTrend(-4.9));
        assertEquals(ForecastTrend.VOLATILE, AggregateForecastCalculator.classifyTrend(7.0));
        assertEquals(ForecastTrend.VOLATILE, AggregateForecastCalculator.classifyTrend(5.0));
        assertEquals(ForecastTrend.VOLATILE, AggregateForecastCalculator.classifyTrend(-9.99));
    }

    private static Prediction prediction(double amount) {
        return Prediction.builder()
                .date(LocalDate.of(2024, 1, 1))
                .predictedAmount(amount)
                .confidenceLower(amount)
                .confidenceUpper(amount)
                .confidenceLevel(95)
                .build();
    }
}
