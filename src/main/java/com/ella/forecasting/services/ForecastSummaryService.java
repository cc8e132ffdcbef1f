package com.ella.forecasting.services;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ella.forecasting.dto.forecast.AccuracyOverviewDTO;
import com.ella.forecasting.dto.forecast.AlertCountsDTO;
import com.ella.forecasting.dto.forecast.CategoryForecastDTO;
import com.ella.forecasting.dto.forecast.ForecastSummaryDTO;
import com.ella.forecasting.entities.Forecast;
import com.ella.forecasting.entities.ForecastAlert;
import com.ella.forecasting.enums.ForecastStatus;
import com.ella.forecasting.repositories.ForecastRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class ForecastSummaryService {

    private static final String ALL_CATEGORIES = "All Categories";

    private final ForecastRepository forecastRepository;
    private final Clock clock;

    /**
     * Rolls up the active forecasts whose window contains today.
     */
    @Transactional(readOnly = true)
    public ForecastSummaryDTO getForecastSummary(UUID userId) {
        List<Forecast> current = forecastRepository.findCurrentForecasts(
                userId, ForecastStatus.ACTIVE, LocalDate.now(clock));

        double totalPredicted = 0.0;
        List<CategoryForecastDTO> categories = new ArrayList<>();
        AlertCountsDTO alertCounts = AlertCountsDTO.builder().build();
        Map<String, Double> byCategory = new LinkedHashMap<>();
        double accuracySum = 0.0;
        int tracked = 0;

        for (Forecast forecast : current) {
            String label = forecast.getCategory() != null ? forecast.getCategory() : ALL_CATEGORIES;
            double predicted = forecast.getAggregateForecast() != null
                    ? forecast.getAggregateForecast().getTotalPredicted()
                    : 0.0;
            totalPredicted += predicted;

            // só conta quem já teve algum mês acompanhado
            Double accuracy = !forecast.getAccuracyTracking().isEmpty() && forecast.getModelMetadata() != null
                    ? forecast.getModelMetadata().getAccuracyScore()
                    : null;

            categories.add(CategoryForecastDTO.builder()
                    .category(label)
                    .predicted(predicted)
                    .trend(forecast.getAggregateForecast() != null ? forecast.getAggregateForecast().getTrend() : null)
                    .accuracy(accuracy)
                    .build());

            for (ForecastAlert alert : forecast.getAlerts()) {
                if (!alert.isAcknowledged()) {
                    countAlert(alertCounts, alert);
                }
            }

            if (accuracy != null) {
                accuracySum += accuracy;
                tracked++;
                if (forecast.getCategory() != null) {
                    byCategory.put(forecast.getCategory(), accuracy);
                }
            }
        }

        return ForecastSummaryDTO.builder()
                .totalForecasts(current.size())
                .totalPredictedSpending(totalPredicted)
                .categories(categories)
                .alerts(alertCounts)
                .accuracy(AccuracyOverviewDTO.builder()
                        .overall(tracked > 0 ? accuracySum / tracked : null)
                        .byCategory(byCategory)
                        .build())
                .build();
    }

    private void countAlert(AlertCountsDTO counts, ForecastAlert alert) {
        counts.setTotalUnacknowledged(counts.getTotalUnacknowledged() + 1);
        switch (alert.getSeverity()) {
            case CRITICAL -> counts.setCritical(counts.getCritical() + 1);
            case HIGH -> counts.setHigh(counts.getHigh() + 1);
            case MEDIUM -> counts.setMedium(counts.getMedium() + 1);
            case LOW -> counts.setLow(counts.getLow() + 1);
        }
    }
}
