package com.ella.forecasting.services;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.ella.forecasting.dto.forecast.AccuracyUpdateSummaryDTO;
import com.ella.forecasting.enums.ForecastStatus;
import com.ella.forecasting.repositories.ForecastRepository;
import com.ella.forecasting.services.forecasting.AccuracyRecordResult;
import com.ella.forecasting.services.forecasting.ForecastAccuracyRecorder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the accuracy recorder over every active forecast of a user. Each forecast is committed on its
 * own, so a failure halfway keeps the months already recorded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastAccuracyService {

    private final ForecastRepository forecastRepository;
    private final ForecastAccuracyRecorder accuracyRecorder;
    private final Clock clock;

    public AccuracyUpdateSummaryDTO updateForecastAccuracy(UUID userId) {
        LocalDate today = LocalDate.now(clock);
        List<UUID> forecastIds = forecastRepository.findIdsByUserIdAndStatus(userId, ForecastStatus.ACTIVE);

        int recorded = 0;
        int pending = 0;
        for (UUID forecastId : forecastIds) {
            AccuracyRecordResult result = accuracyRecorder.record(forecastId, today);
            recorded += result.entriesRecorded();
            pending += result.monthsPending();
        }

        log.info("[ForecastAccuracyService] userId={} forecasts={} recorded={} pending={}",
                userId, forecastIds.size(), recorded, pending);
        return new AccuracyUpdateSummaryDTO(forecastIds.size(), recorded, pending, "Forecast accuracy updated");
    }
}
