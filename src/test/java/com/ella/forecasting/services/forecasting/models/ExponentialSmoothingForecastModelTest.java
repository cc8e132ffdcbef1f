package com.ella.forecasting.services.forecasting.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.ella.forecasting.config.ForecastingProperties;
import com.ella.forecasting.entities.Prediction;
import com.ella.forecasting.services.forecasting.ForecastTestData;

class ExponentialSmoothingForecastModelTest {

    private final ExponentialSmoothingForecastModel model =
            new ExponentialSmoothingForecastModel(ForecastingProperties.defaults());

    @Test
    void fit_repeatsLastSmoothedLevel() {
        // alpha 0.3: 100 -> 130 -> 181
        ForecastModelResult result = model.fit(
                ForecastTestData.monthly(LocalDate.of(2023, 10, 1), 100, 200, 300),
                List.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1), LocalDate.of(2024, 3, 1)),
                80);

        for (Prediction p : result.predictions()) {
            assertEquals(181.0, p.getPredictedAmount(), 1e-9);
            assertEquals(80, p.getConfidenceLevel());
            assertTrue(p.getConfidenceLower() <= p.getPredictedAmount());
            assertTrue(p.getConfidenceUpper() >= p.getPredictedAmount());
        }
        assertEquals(63.0, result.mae(), 1e-9);
        assertEquals(79.71, result.rmse(), 0.01);
        assertEquals(68.5, result.accuracyScore(), 1e-9);
    }

    @Test
    void fit_wideBand_lowerBoundNeverNegative() {
        ForecastModelResult result = model.fit(
                ForecastTestData.monthly(LocalDate.of(2023, 1, 1), 10, 1000, 10, 1000),
                List.of(LocalDate.of(2023, 5, 1)),
                95);

        Prediction p = result.predictions().get(0);
        assertEquals(0.0, p.getConfidenceLower(), 1e-9);
    }
}
