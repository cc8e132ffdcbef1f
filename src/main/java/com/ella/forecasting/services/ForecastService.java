package com.ella.forecasting.services;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ella.forecasting.config.ForecastingProperties;
import com.ella.forecasting.dto.forecast.ForecastAlertDTO;
import com.ella.forecasting.dto.forecast.ForecastRequest;
import com.ella.forecasting.dto.forecast.ForecastResponseDTO;
import com.ella.forecasting.dto.forecast.SeasonalPatternDTO;
import com.ella.forecasting.dto.forecast.SpendingTrendDTO;
import com.ella.forecasting.entities.AggregateForecast;
import com.ella.forecasting.entities.BudgetComparison;
import com.ella.forecasting.entities.Forecast;
import com.ella.forecasting.entities.ForecastAlert;
import com.ella.forecasting.entities.ForecastPeriod;
import com.ella.forecasting.entities.ModelMetadata;
import com.ella.forecasting.entities.SeasonalFactor;
import com.ella.forecasting.enums.AlertSeverity;
import com.ella.forecasting.enums.ForecastAlgorithm;
import com.ella.forecasting.enums.ForecastStatus;
import com.ella.forecasting.enums.PeriodType;
import com.ella.forecasting.exceptions.BadRequestException;
import com.ella.forecasting.exceptions.ResourceNotFoundException;
import com.ella.forecasting.mappers.ForecastMapper;
import com.ella.forecasting.repositories.ForecastRepository;
import com.ella.forecasting.services.forecasting.AggregateForecastCalculator;
import com.ella.forecasting.services.forecasting.BudgetComparator;
import com.ella.forecasting.services.forecasting.ForecastAdvisor;
import com.ella.forecasting.services.forecasting.ForecastExpiryPolicy;
import com.ella.forecasting.services.forecasting.ForecastPeriodCalculator;
import com.ella.forecasting.services.forecasting.ForecastWindow;
import com.ella.forecasting.services.forecasting.HistoricalPoint;
import com.ella.forecasting.services.forecasting.HistoricalSpendingAggregator;
import com.ella.forecasting.services.forecasting.SeasonalFactorDetector;
import com.ella.forecasting.services.forecasting.models.ForecastModelResult;
import com.ella.forecasting.services.forecasting.models.ForecastModelSelector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    private static final String ALL_CATEGORIES = "All Categories";

    private final ForecastPeriodCalculator periodCalculator;
    private final HistoricalSpendingAggregator historicalAggregator;
    private final ForecastModelSelector modelSelector;
    private final AggregateForecastCalculator aggregateCalculator;
    private final SeasonalFactorDetector seasonalFactorDetector;
    private final BudgetComparator budgetComparator;
    private final ForecastAdvisor forecastAdvisor;
    private final ForecastExpiryPolicy expiryPolicy;
    private final ForecastRepository forecastRepository;
    private final ForecastingProperties properties;
    private final Clock clock;

    /**
     * Fits the requested model and persists the forecast. Nothing is written when any stage fails.
     */
    @Transactional
    public ForecastResponseDTO generateForecast(UUID userId, ForecastRequest request) {
        PeriodType periodType = parsePeriodType(request.getPeriodType());
        ForecastAlgorithm algorithm = parseAlgorithm(request.getAlgorithm());
        int confidenceLevel = resolveConfidenceLevel(request.getConfidenceLevel());
        String category = normalizeCategory(request.getCategory());

        ForecastWindow window = periodCalculator.calculate(periodType, LocalDate.now(clock));
        log.info("[ForecastService] userId={} category={} period={} algorithm={} history {} -> {}",
                userId, category, periodType.getValue(), algorithm.getValue(),
                window.historicalStart(), window.historicalEnd());

        List<HistoricalPoint> history = historicalAggregator.loadMonthlyHistory(
                userId, category, window.historicalStart(), window.historicalEnd());

        ForecastModelResult fit = modelSelector.select(algorithm)
                .fit(history, window.predictionDates(), confidenceLevel);

        AggregateForecast aggregate = aggregateCalculator.calculate(fit.predictions(), history);
        List<SeasonalFactor> seasonalFactors = seasonalFactorDetector.detect(history);
        BudgetComparison comparison = budgetComparator.compare(userId, category, aggregate.getTotalPredicted());

        LocalDateTime now = LocalDateTime.now(clock);
        Forecast forecast = Forecast.builder()
                .userId(userId)
                .forecastPeriod(ForecastPeriod.builder()
                        .startDate(window.forecastStart())
                        .endDate(window.forecastEnd())
                        .periodType(periodType)
                        .build())
                .category(category)
                .predictions(new ArrayList<>(fit.predictions()))
                .aggregateForecast(aggregate)
                .seasonalFactors(new ArrayList<>(seasonalFactors))
                .modelMetadata(ModelMetadata.builder()
                        .algorithm(algorithm)
                        .accuracyScore(fit.accuracyScore())
                        .rmse(fit.rmse())
                        .mae(fit.mae())
                        .trainingDataPoints(history.size())
                        .lastTrained(now)
                        .build())
                .comparison(comparison)
                .recommendations(new ArrayList<>(forecastAdvisor.recommend(aggregate, comparison)))
                .alerts(new ArrayList<>(forecastAdvisor.raiseAlerts(aggregate, comparison, now)))
                .status(ForecastStatus.ACTIVE)
                .build();

        archiveSupersededForecasts(userId, category, periodType, LocalDate.now(clock));
        Forecast saved = save(forecast);
        log.info("[ForecastService] forecast {} saved: predictions={} total={} trend={} alerts={}",
                saved.getId(), saved.getPredictions().size(), aggregate.getTotalPredicted(),
                aggregate.getTrend().getValue(), saved.getAlerts().size());
        return ForecastMapper.toResponseDTO(saved, LocalDate.now(clock));
    }

    @Transactional
    public ForecastResponseDTO getForecastById(UUID forecastId, UUID userId) {
        Forecast forecast = findOwnedForecast(forecastId, userId);
        return ForecastMapper.toResponseDTO(forecast, LocalDate.now(clock));
    }

    /**
     * Active forecasts of the user, newest window first.
     */
    @Transactional
    public List<ForecastResponseDTO> getUserForecasts(UUID userId, String category, String periodType) {
        PeriodType periodFilter = periodType == null || periodType.isBlank() ? null : parsePeriodType(periodType);
        String categoryFilter = normalizeCategory(category);
        LocalDate today = LocalDate.now(clock);

        return loadActiveForecasts(userId).stream()
                .filter(f -> categoryFilter == null || categoryFilter.equalsIgnoreCase(f.getCategory()))
                .filter(f -> periodFilter == null || f.getForecastPeriod().getPeriodType() == periodFilter)
                .map(f -> ForecastMapper.toResponseDTO(f, today))
                .toList();
    }

    @Transactional
    public ForecastResponseDTO acknowledgeAlert(UUID forecastId, UUID alertId, UUID userId) {
        Forecast forecast = findOwnedForecast(forecastId, userId);
        ForecastAlert alert = forecast.findAlert(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert not found"));
        alert.setAcknowledged(true);
        return ForecastMapper.toResponseDTO(save(forecast), LocalDate.now(clock));
    }

    @Transactional
    public ForecastResponseDTO archiveForecast(UUID forecastId, UUID userId) {
        Forecast forecast = findOwnedForecast(forecastId, userId);
        forecast.setStatus(ForecastStatus.ARCHIVED);
        log.info("[ForecastService] forecast {} archived by userId={}", forecastId, userId);
        return ForecastMapper.toResponseDTO(save(forecast), LocalDate.now(clock));
    }

    /**
     * Unacknowledged alerts of active forecasts, most severe first and newest first within a severity.
     */
    @Transactional
    public List<ForecastAlertDTO> getUnacknowledgedAlerts(UUID userId, String severity) {
        AlertSeverity severityFilter = null;
        if (severity != null && !severity.isBlank()) {
            severityFilter = AlertSeverity.fromValue(severity)
                    .orElseThrow(() -> new BadRequestException("Invalid alert severity: " + severity));
        }
        AlertSeverity filter = severityFilter;

        return loadActiveForecasts(userId).stream()
                .flatMap(f -> f.getAlerts().stream()
                        .filter(alert -> !alert.isAcknowledged())
                        .filter(alert -> filter == null || alert.getSeverity() == filter)
                        .map(alert -> ForecastMapper.toAlertDTO(f, alert)))
                .sorted(Comparator.comparing(ForecastAlertDTO::severity, Comparator.reverseOrder())
                        .thenComparing(ForecastAlertDTO::triggeredAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    @Transactional
    public List<SpendingTrendDTO> getSpendingTrends(UUID userId) {
        return loadActiveForecasts(userId).stream()
                .filter(f -> f.getAggregateForecast() != null)
                .map(f -> new SpendingTrendDTO(
                        f.getCategory() != null ? f.getCategory() : ALL_CATEGORIES,
                        f.getAggregateForecast().getTrend(),
                        f.getAggregateForecast().getTrendPercentage(),
                        f.getForecastPeriod().getPeriodType()))
                .toList();
    }

    /**
     * Seasonal factors over the yearly lookback window. Nothing is persisted.
     */
    @Transactional(readOnly = true)
    public SeasonalPatternDTO getSeasonalPatterns(UUID userId, String category) {
        String normalized = normalizeCategory(category);
        ForecastWindow window = periodCalculator.calculate(PeriodType.YEARLY, LocalDate.now(clock));
        List<HistoricalPoint> history = historicalAggregator.loadMonthlyHistory(
                userId, normalized, window.historicalStart(), window.historicalEnd());

        return new SeasonalPatternDTO(
                normalized != null ? normalized : ALL_CATEGORIES,
                window.historicalStart(),
                window.historicalEnd(),
                history.size(),
                seasonalFactorDetector.detect(history)
        );
    }

    private List<Forecast> loadActiveForecasts(UUID userId) {
        List<Forecast> forecasts = forecastRepository
                .findByUserIdAndStatusOrderByForecastPeriodStartDateDesc(userId, ForecastStatus.ACTIVE);
        List<Forecast> active = new ArrayList<>(forecasts.size());
        for (Forecast forecast : forecasts) {
            if (expiryPolicy.refresh(forecast)) {
                forecastRepository.save(forecast);
                continue;
            }
            active.add(forecast);
        }
        return active;
    }

    /**
     * A scope (user, category, period type) keeps a single active forecast covering a given day.
     */
    private void archiveSupersededForecasts(UUID userId, String category, PeriodType periodType, LocalDate today) {
        for (Forecast current : forecastRepository.findCurrentForecasts(userId, ForecastStatus.ACTIVE, today)) {
            boolean sameCategory = category == null
                    ? current.getCategory() == null
                    : category.equalsIgnoreCase(current.getCategory());
            if (sameCategory && current.getForecastPeriod().getPeriodType() == periodType) {
                current.setStatus(ForecastStatus.ARCHIVED);
                forecastRepository.save(current);
                log.info("[ForecastService] forecast {} superseded for userId={} category={} period={}",
                        current.getId(), userId, category, periodType.getValue());
            }
        }
    }

    private Forecast findOwnedForecast(UUID forecastId, UUID userId) {
        Forecast forecast = forecastRepository.findByIdAndUserId(forecastId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Forecast not found"));
        if (expiryPolicy.refresh(forecast)) {
            forecast = forecastRepository.save(forecast);
        }
        return forecast;
    }

    private Forecast save(Forecast forecast) {
        expiryPolicy.refresh(forecast);
        return forecastRepository.save(forecast);
    }

    private PeriodType parsePeriodType(String raw) {
        if (raw == null || raw.isBlank()) {
            return PeriodType.MONTHLY;
        }
        return PeriodType.fromValue(raw)
                .orElseThrow(() -> new BadRequestException("Unsupported period type: " + raw));
    }

    private ForecastAlgorithm parseAlgorithm(String raw) {
        if (raw == null || raw.isBlank()) {
            return ForecastAlgorithm.MOVING_AVERAGE;
        }
        return ForecastAlgorithm.fromValue(raw)
                .orElseThrow(() -> new BadRequestException("Unsupported forecasting algorithm: " + raw));
    }

    private int resolveConfidenceLevel(Integer requested) {
        if (requested == null) {
            return properties.defaultConfidenceLevel();
        }
        if (requested < 80 || requested > 99) {
            throw new BadRequestException("Confidence level must be between 80 and 99");
        }
        return requested;
    }

    private String normalizeCategory(String category) {
        if (category == null || category.isBlank()) {
            return null;
        }
        return category.trim();
    }
}
