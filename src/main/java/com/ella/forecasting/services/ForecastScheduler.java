package com.ella.forecasting.services;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.ella.forecasting.config.ForecastingProperties;
import com.ella.forecasting.dto.forecast.ForecastRequest;
import com.ella.forecasting.enums.ForecastAlgorithm;
import com.ella.forecasting.enums.ForecastStatus;
import com.ella.forecasting.enums.PeriodType;
import com.ella.forecasting.exceptions.InsufficientHistoryException;
import com.ella.forecasting.repositories.ExpenseRepository;
import com.ella.forecasting.repositories.ForecastRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ella.forecasting.scheduler", name = "enabled", havingValue = "true")
public class ForecastScheduler {

    private final ForecastService forecastService;
    private final ForecastAccuracyService accuracyService;
    private final ExpenseRepository expenseRepository;
    private final ForecastRepository forecastRepository;
    private final ForecastingProperties properties;
    private final Clock clock;

    /**
     * Monthly moving-average forecasts for users with recent expenses: one overall plus one per top category.
     */
    @Scheduled(cron = "${ella.forecasting.scheduler.generation-cron:0 0 6 * * *}", scheduler = "forecastTaskScheduler")
    public void generateDailyForecasts() {
        ForecastingProperties.Scheduler config = properties.scheduler();
        LocalDate since = LocalDate.now(clock).minusDays(config.activityLookbackDays());
        List<UUID> userIds = expenseRepository.findOwnerIdsWithExpensesSince(since);
        log.info("[ForecastScheduler] generation started for {} users", userIds.size());

        int generated = 0;
        for (UUID userId : userIds) {
            List<String> categories = new ArrayList<>();
            categories.add(null);
            categories.addAll(expenseRepository.findTopCategoriesSince(
                    userId, since, PageRequest.of(0, config.topCategories())));

            for (String category : categories) {
                try {
                    forecastService.generateForecast(userId, ForecastRequest.builder()
                            .periodType(PeriodType.MONTHLY.getValue())
                            .algorithm(ForecastAlgorithm.MOVING_AVERAGE.getValue())
                            .category(category)
                            .build());
                    generated++;
                } catch (InsufficientHistoryException e) {
                    log.debug("[ForecastScheduler] userId={} category={} skipped: {}", userId, category, e.getMessage());
                } catch (RuntimeException e) {
                    log.warn("[ForecastScheduler] userId={} category={} generation failed: {}",
                            userId, category, e.getMessage(), e);
                }
            }
        }
        log.info("[ForecastScheduler] generation finished: {} forecasts", generated);
    }

    @Scheduled(cron = "${ella.forecasting.scheduler.accuracy-cron:0 0 23 * * *}", scheduler = "forecastTaskScheduler")
    public void updateDailyAccuracy() {
        List<UUID> userIds = forecastRepository.findDistinctUserIdsByStatus(ForecastStatus.ACTIVE);
        log.info("[ForecastScheduler] accuracy update started for {} users", userIds.size());

        for (UUID userId : userIds) {
            try {
                accuracyService.updateForecastAccuracy(userId);
            } catch (RuntimeException e) {
                log.warn("[ForecastScheduler] userId={} accuracy update failed: {}", userId, e.getMessage(), e);
            }
        }
    }
}
