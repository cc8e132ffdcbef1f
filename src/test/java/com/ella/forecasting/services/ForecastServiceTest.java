package com.ella.forecasting.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ella.forecasting.config.ForecastingProperties;
import com.ella.forecasting.dto.forecast.ForecastAlertDTO;
import com.ella.forecasting.dto.forecast.ForecastRequest;
import com.ella.forecasting.dto.forecast.ForecastResponseDTO;
import com.ella.forecasting.dto.forecast.SeasonalPatternDTO;
import com.ella.forecasting.entities.Forecast;
import com.ella.forecasting.entities.ForecastAlert;
import com.ella.forecasting.entities.ForecastPeriod;
import com.ella.forecasting.enums.AlertSeverity;
import com.ella.forecasting.enums.AlertType;
import com.ella.forecasting.enums.ForecastAlgorithm;
import com.ella.forecasting.enums.ForecastStatus;
import com.ella.forecasting.enums.ForecastTrend;
import com.ella.forecasting.enums.PeriodType;
import com.ella.forecasting.exceptions.BadRequestException;
import com.ella.forecasting.exceptions.InsufficientHistoryException;
import com.ella.forecasting.exceptions.ResourceNotFoundException;
import com.ella.forecasting.repositories.ForecastRepository;
import com.ella.forecasting.services.forecasting.AggregateForecastCalculator;
import com.ella.forecasting.services.forecasting.BudgetComparator;
import com.ella.forecasting.services.forecasting.ForecastAdvisor;
import com.ella.forecasting.services.forecasting.ForecastExpiryPolicy;
import com.ella.forecasting.services.forecasting.ForecastPeriodCalculator;
import com.ella.forecasting.services.forecasting.HistoricalSpendingAggregator;
import com.ella.forecasting.services.forecasting.SeasonalFactorDetector;
import com.ella.forecasting.services.forecasting.models.ExponentialSmoothingForecastModel;
import com.ella.forecasting.services.forecasting.models.ForecastModelSelector;
import com.ella.forecasting.services.forecasting.models.LinearRegressionForecastModel;
import com.ella.forecasting.services.forecasting.models.MovingAverageForecastModel;
import com.ella.forecasting.services.forecasting.sources.BudgetSource;
import com.ella.forecasting.services.forecasting.sources.SpendingRecord;
import com.ella.forecasting.services.forecasting.sources.TransactionHistorySource;

@ExtendWith(MockitoExtension.class)
class ForecastServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    @Mock
    private TransactionHistorySource transactionHistorySource;

    @Mock
    private BudgetSource budgetSource;

    @Mock
    private ForecastRepository forecastRepository;

    private ForecastService forecastService;
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TODAY.atTime(9, 30).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        ForecastingProperties properties = ForecastingProperties.defaults();
        forecastService = new ForecastService(
                new ForecastPeriodCalculator(clock),
                new HistoricalSpendingAggregator(transactionHistorySource, properties),
                new ForecastModelSelector(List.of(
                        new MovingAverageForecastModel(properties),
                        new LinearRegressionForecastModel(properties),
                        new ExponentialSmoothingForecastModel(properties))),
                new AggregateForecastCalculator(),
                new SeasonalFactorDetector(),
                new BudgetComparator(budgetSource),
                new ForecastAdvisor(),
                new ForecastExpiryPolicy(clock),
                forecastRepository,
                properties,
                clock);
    }

    @Test
    void generateForecast_overBudget_persistsForecastWithAlert() {
        when(transactionHistorySource.fetchTransactions(userId, "Food", LocalDate.of(2023, 3, 15), TODAY))
                .thenReturn(List.of(
                        record(2023, 12, 10, "100"),
                        record(2024, 1, 10, "200"),
                        record(2024, 2, 10, "300")));
        when(budgetSource.fetchActiveBudget(userId, "Food")).thenReturn(Optional.of(new BigDecimal("150")));
        when(forecastRepository.save(any(Forecast.class))).thenAnswer(inv -> {
            Forecast f = inv.getArgument(0);
            f.setId(UUID.randomUUID());
            return f;
        });

        ForecastResponseDTO response = forecastService.generateForecast(userId, ForecastRequest.builder()
                .periodType("monthly")
                .category("  Food ")
                .build());

        ArgumentCaptor<Forecast> captor = ArgumentCaptor.forClass(Forecast.class);
        verify(forecastRepository).save(captor.capture());
        Forecast saved = captor.getValue();

        assertEquals("Food", saved.getCategory());
        assertEquals(ForecastStatus.ACTIVE, saved.getStatus());
        assertEquals(PeriodType.MONTHLY, saved.getForecastPeriod().getPeriodType());
        assertEquals(TODAY.plusMonths(1), saved.getForecastPeriod().getEndDate());
        assertEquals(1, saved.getPredictions().size());
        assertEquals(200.0, saved.getPredictions().get(0).getPredictedAmount(), 1e-9);
        assertEquals(95, saved.getPredictions().get(0).getConfidenceLevel());
        assertEquals(ForecastAlgorithm.MOVING_AVERAGE, saved.getModelMetadata().getAlgorithm());
        assertEquals(3, saved.getModelMetadata().getTrainingDataPoints());
        assertEquals(LocalDateTime.of(2024, 3, 15, 9, 30), saved.getModelMetadata().getLastTrained());
        assertEquals(ForecastTrend.STABLE, saved.getAggregateForecast().getTrend());
        assertEquals(50.0, saved.getComparison().getForecastVsBudget(), 1e-9);
        assertEquals(1, saved.getAlerts().size());
        assertEquals(AlertType.FORECAST_EXCEEDS_BUDGET, saved.getAlerts().get(0).getAlertType());
        assertEquals(3, saved.getSeasonalFactors().size());

        assertNotNull(response.getId());
        assertEquals(31, response.getDaysRemaining());
        assertNull(response.getForecastAccuracy());
    }

    @Test
    void generateForecast_sameScopeAlreadyActive_archivesPreviousForecast() {
        Forecast previous = activeForecast("food");
        Forecast otherPeriod = activeForecast("Food");
        otherPeriod.getForecastPeriod().setPeriodType(PeriodType.QUARTERLY);
        Forecast overall = activeForecast(null);

        when(forecastRepository.findCurrentForecasts(userId, ForecastStatus.ACTIVE, TODAY))
                .thenReturn(List.of(previous, otherPeriod, overall));
        when(transactionHistorySource.fetchTransactions(userId, "Food", LocalDate.of(2023, 3, 15), TODAY))
                .thenReturn(List.of(
                        record(2023, 12, 10, "100"),
                        record(2024, 1, 10, "100"),
                        record(2024, 2, 10, "100")));
        when(forecastRepository.save(any(Forecast.class))).thenAnswer(inv -> inv.getArgument(0));

        forecastService.generateForecast(userId, ForecastRequest.builder()
                .periodType("monthly")
                .category("Food")
                .build());

        assertEquals(ForecastStatus.ARCHIVED, previous.getStatus());
        assertEquals(ForecastStatus.ACTIVE, otherPeriod.getStatus());
        assertEquals(ForecastStatus.ACTIVE, overall.getStatus());
        verify(forecastRepository).save(previous);
        verify(forecastRepository, never()).save(otherPeriod);
        verify(forecastRepository, never()).save(overall);
    }

    @Test
    void generateForecast_insufficientHistory_nothingPersisted() {
        when(transactionHistorySource.fetchTransactions(any(), any(), any(), any()))
                .thenReturn(List.of(record(2024, 1, 10, "100"), record(2024, 2, 10, "100")));

        assertThrows(InsufficientHistoryException.class,
                () -> forecastService.generateForecast(userId, new ForecastRequest()));

        verify(forecastRepository, never()).save(any());
        verifyNoInteractions(budgetSource);
    }

    @Test
    void generateForecast_unknownAlgorithm_rejectedBeforeFetching() {
        ForecastRequest request = ForecastRequest.builder().algorithm("arima").build();

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> forecastService.generateForecast(userId, request));

        assertTrue(ex.getMessage().contains("arima"));
        verifyNoInteractions(transactionHistorySource, budgetSource, forecastRepository);
    }

    @Test
    void generateForecast_unknownPeriodType_rejected() {
        ForecastRequest request = ForecastRequest.builder().periodType("daily").build();

        assertThrows(BadRequestException.class, () -> forecastService.generateForecast(userId, request));
        verifyNoInteractions(transactionHistorySource);
    }

    @Test
    void generateForecast_confidenceOutOfRange_rejected() {
        ForecastRequest request = ForecastRequest.builder().confidenceLevel(50).build();

        assertThrows(BadRequestException.class, () -> forecastService.generateForecast(userId, request));
    }

    @Test
    void getForecastById_unknown_throwsNotFound() {
        UUID forecastId = UUID.randomUUID();
        when(forecastRepository.findByIdAndUserId(forecastId, userId)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> forecastService.getForecastById(forecastId, userId));
    }

    @Test
    void acknowledgeAlert_marksOnlyThatAlert() {
        ForecastAlert target = alert(AlertSeverity.HIGH, LocalDateTime.of(2024, 3, 1, 6, 0));
        ForecastAlert other = alert(AlertSeverity.MEDIUM, LocalDateTime.of(2024, 3, 1, 6, 0));
        Forecast forecast = activeForecast("Food", target, other);
        when(forecastRepository.findByIdAndUserId(forecast.getId(), userId)).thenReturn(Optional.of(forecast));
        when(forecastRepository.save(forecast)).thenReturn(forecast);

        ForecastResponseDTO response = forecastService.acknowledgeAlert(forecast.getId(), target.getAlertId(), userId);

        assertTrue(target.isAcknowledged());
        assertFalse(other.isAcknowledged());
        assertEquals(2, response.getAlerts().size());
    }

    @Test
    void acknowledgeAlert_unknownAlert_throwsNotFound() {
        Forecast forecast = activeForecast("Food");
        when(forecastRepository.findByIdAndUserId(forecast.getId(), userId)).thenReturn(Optional.of(forecast));

        assertThrows(ResourceNotFoundException.class,
                () -> forecastService.acknowledgeAlert(forecast.getId(), UUID.randomUUID(), userId));
        verify(forecastRepository, never()).save(any());
    }

    @Test
    void archiveForecast_setsArchived() {
        Forecast forecast = activeForecast(null);
        when(forecastRepository.findByIdAndUserId(forecast.getId(), userId)).thenReturn(Optional.of(forecast));
        when(forecastRepository.save(forecast)).thenReturn(forecast);

        ForecastResponseDTO response = forecastService.archiveForecast(forecast.getId(), userId);

        assertEquals(ForecastStatus.ARCHIVED, response.getStatus());
    }

    @Test
    void getUserForecasts_expiredForecastIsSavedAndHidden() {
        Forecast stale = activeForecast("Food");
        stale.getForecastPeriod().setEndDate(TODAY.minusDays(1));
        Forecast current = activeForecast("Food");
        Forecast otherCategory = activeForecast("Travel");
        when(forecastRepository.findByUserIdAndStatusOrderByForecastPeriodStartDateDesc(userId, ForecastStatus.ACTIVE))
                .thenReturn(List.of(stale, current, otherCategory));

        List<ForecastResponseDTO> result = forecastService.getUserForecasts(userId, "food", null);

        assertEquals(1, result.size());
        assertEquals(current.getId(), result.get(0).getId());
        assertEquals(ForecastStatus.EXPIRED, stale.getStatus());
        verify(forecastRepository).save(stale);
    }

    @Test
    void getUnacknowledgedAlerts_criticalFirstThenNewest() {
        ForecastAlert oldHigh = alert(AlertSeverity.HIGH, LocalDateTime.of(2024, 1, 1, 6, 0));
        ForecastAlert newHigh = alert(AlertSeverity.HIGH, LocalDateTime.of(2024, 3, 1, 6, 0));
        ForecastAlert critical = alert(AlertSeverity.CRITICAL, LocalDateTime.of(2023, 12, 1, 6, 0));
        ForecastAlert acknowledged = alert(AlertSeverity.CRITICAL, LocalDateTime.of(2024, 3, 2, 6, 0));
        acknowledged.setAcknowledged(true);
        when(forecastRepository.findByUserIdAndStatusOrderByForecastPeriodStartDateDesc(userId, ForecastStatus.ACTIVE))
                .thenReturn(List.of(activeForecast("Food", oldHigh, acknowledged), activeForecast(null, newHigh, critical)));

        List<ForecastAlertDTO> alerts = forecastService.getUnacknowledgedAlerts(userId, null);

        assertEquals(List.of(critical.getAlertId(), newHigh.getAlertId(), oldHigh.getAlertId()),
                alerts.stream().map(ForecastAlertDTO::alertId).toList());
        assertEquals("Food", alerts.get(2).forecastCategory());
    }

    @Test
    void getUnacknowledgedAlerts_invalidSeverity_rejected() {
        assertThrows(BadRequestException.class, () -> forecastService.getUnacknowledgedAlerts(userId, "urgent"));
    }

    @Test
    void getSeasonalPatterns_usesYearlyLookbackAndDoesNotPersist() {
        when(transactionHistorySource.fetchTransactions(userId, null, LocalDate.of(2021, 3, 15), TODAY))
                .thenReturn(List.of(
                        record(2023, 12, 10, "300"),
                        record(2024, 1, 10, "100"),
                        record(2024, 2, 10, "200")));

        SeasonalPatternDTO patterns = forecastService.getSeasonalPatterns(userId, null);

        assertEquals("All Categories", patterns.category());
        assertEquals(3, patterns.monthsAnalyzed());
        assertEquals(3, patterns.seasonalFactors().size());
        verifyNoInteractions(forecastRepository);
    }

    private Forecast activeForecast(String category, ForecastAlert... alerts) {
        return Forecast.builder()
                .id(UUID.randomUUID())
                .userId(userId)
                .category(category)
                .forecastPeriod(ForecastPeriod.builder()
                        .startDate(TODAY.minusDays(5))
                        .endDate(TODAY.plusDays(25))
                        .periodType(PeriodType.MONTHLY)
                        .build())
                .alerts(new ArrayList<>(List.of(alerts)))
                .status(ForecastStatus.ACTIVE)
                .build();
    }

    private static ForecastAlert alert(AlertSeverity severity, LocalDateTime triggeredAt) {
        return ForecastAlert.builder()
                .alertId(UUID.randomUUID())
                .alertType(AlertType.FORECAST_EXCEEDS_BUDGET)
                .severity(severity)
                .message("test")
                .triggeredAt(triggeredAt)
                .acknowledged(false)
                .build();
    }

    private static SpendingRecord record(int year, int month, int day, String amount) {
        return new SpendingRecord(LocalDate.of(year, month, day), new BigDecimal(amount));
    }
}
