package com.ella.forecasting.entities;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.LocalDate;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

class ForecastTest {

    @Test
    void getForecastAccuracy_nothingTracked_returnsNull() {
        assertNull(Forecast.builder().build().getForecastAccuracy());
    }

    @Test
    void getForecastAccuracy_averagesAbsoluteErrors() {
        Forecast forecast = Forecast.builder().build();
        forecast.getAccuracyTracking().add(entry(1, 10));
        forecast.getAccuracyTracking().add(entry(2, -30));

        assertEquals(80.0, forecast.getForecastAccuracy(), 1e-9);
    }

    @Test
    void getForecastAccuracy_errorAboveHundredPercent_floorsAtZero() {
        Forecast forecast = Forecast.builder().build();
        forecast.getAccuracyTracking().add(entry(1, 250));

        assertEquals(0.0, forecast.getForecastAccuracy(), 1e-9);
    }

    private static AccuracyTrackingEntry entry(int month, double errorPercentage) {
        return AccuracyTrackingEntry.builder()
                .predictionDate(LocalDate.of(2024, month, 15))
                .predictionMonth(LocalDate.of(2024, month, 1))
                .predictedAmount(100)
                .actualAmount(100 + errorPercentage)
                .errorPercentage(errorPercentage)
                .recordedAt(LocalDateTime.of(2024, month + 1, 1, 23, 0))
                .build();
    }
}
