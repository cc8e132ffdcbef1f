package com.ella.forecasting.services.forecasting;

import java.time.Clock;
import java.time.LocalDate;

import org.springframework.stereotype.Component;

import com.ella.forecasting.enums.PeriodType;

import lombok.RequiredArgsConstructor;

/**
 * Derives forecast and lookback windows from the requested period type.
 *
 * History is always grouped by calendar month, whatever the period type: a weekly forecast still
 * yields one monthly prediction and a yearly forecast yields twelve.
 */
@Component
@RequiredArgsConstructor
public class ForecastPeriodCalculator {

    private final Clock clock;

    public ForecastWindow calculate(PeriodType periodType) {
        return calculate(periodType, LocalDate.now(clock));
    }

    public ForecastWindow calculate(PeriodType periodType, LocalDate today) {
        return switch (periodType) {
            case WEEKLY -> new ForecastWindow(today, today.plusDays(7), today.minusDays(90), today);
            case MONTHLY -> new ForecastWindow(today, today.plusMonths(1), today.minusMonths(12), today);
            case QUARTERLY -> new ForecastWindow(today, today.plusMonths(3), today.minusMonths(24), today);
            case YEARLY -> new ForecastWindow(today, today.plusMonths(12), today.minusMonths(36), today);
        };
    }
}
