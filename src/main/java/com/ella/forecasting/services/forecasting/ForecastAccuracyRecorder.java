package com.ella.forecasting.services.forecasting;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.ella.forecasting.config.ForecastingProperties;
import com.ella.forecasting.entities.AccuracyTrackingEntry;
import com.ella.forecasting.entities.Forecast;
import com.ella.forecasting.entities.Prediction;
import com.ella.forecasting.enums.ForecastStatus;
import com.ella.forecasting.repositories.ForecastRepository;
import com.ella.forecasting.services.forecasting.sources.ActualSpendingSource;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Compares past predictions of one forecast with realized spending.
 *
 * Each call runs in its own transaction and holds a write lock on the forecast row, so two runs for
 * the same forecast are serialized and the second finds the month already tracked.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForecastAccuracyRecorder {

    private final ForecastRepository forecastRepository;
    private final ActualSpendingSource actualSpendingSource;
    private final ForecastExpiryPolicy expiryPolicy;
    private final ForecastingProperties properties;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AccuracyRecordResult record(UUID forecastId, LocalDate today) {
        Optional<Forecast> locked = forecastRepository.findByIdForUpdate(forecastId);
        if (locked.isEmpty()) {
            return AccuracyRecordResult.nothing();
        }

        Forecast forecast = locked.get();
        if (expiryPolicy.refresh(forecast, today)) {
            forecastRepository.save(forecast);
        }
        if (forecast.getStatus() != ForecastStatus.ACTIVE) {
            return AccuracyRecordResult.nothing();
        }

        int recorded = 0;
        int pending = 0;
        for (Prediction prediction : forecast.getPredictions()) {
            if (!prediction.getDate().isBefore(today)) continue;

            YearMonth month = YearMonth.from(prediction.getDate());
            if (forecast.isTracked(month)) continue;

            Optional<BigDecimal> actual = actualSpendingSource.fetchActualSpending(
                    forecast.getUserId(), forecast.getCategory(), month.atDay(1), month.atEndOfMonth());
            if (actual.isEmpty()) {
                pending++;
                continue;
            }

            forecast.getAccuracyTracking().add(trackingEntry(prediction, month, actual.get().doubleValue()));
            recorded++;
        }

        if (recorded > 0) {
            recomputeAccuracyScore(forecast);
            expiryPolicy.refresh(forecast, today);
            forecastRepository.save(forecast);
            log.info("[ForecastAccuracyRecorder] forecastId={} recorded={} accuracyScore={}",
                    forecastId, recorded, forecast.getModelMetadata().getAccuracyScore());
        }
        return new AccuracyRecordResult(recorded, pending);
    }

    private AccuracyTrackingEntry trackingEntry(Prediction prediction, YearMonth month, double actualAmount) {
        return AccuracyTrackingEntry.builder()
                .predictionDate(prediction.getDate())
                .predictionMonth(month.atDay(1))
                .predictedAmount(prediction.getPredictedAmount())
                .actualAmount(actualAmount)
                .errorPercentage(errorPercentage(prediction.getPredictedAmount(), actualAmount))
                .recordedAt(LocalDateTime.now(clock))
                .build();
    }

    static double errorPercentage(double predicted, double actual) {
        if (predicted == 0.0) {
            return actual == 0.0 ? 0.0 : 100.0;
        }
        return ForecastMath.finite((actual - predicted) / predicted * 100.0);
    }

    private void recomputeAccuracyScore(Forecast forecast) {
        List<AccuracyTrackingEntry> tracking = forecast.getAccuracyTracking();
        int window = Math.min(properties.accuracyWindow(), tracking.size());
        double averageError = tracking.subList(tracking.size() - window, tracking.size()).stream()
                .mapToDouble(entry -> Math.abs(entry.getErrorPercentage()))
                .average()
                .orElse(0.0);
        forecast.getModelMetadata().setAccuracyScore(ForecastMath.clamp(100.0 - averageError, 0.0, 100.0));
    }
}
