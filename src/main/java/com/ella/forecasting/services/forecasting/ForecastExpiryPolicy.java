package com.ella.forecasting.services.forecasting;

import java.time.Clock;
import java.time.LocalDate;

import org.springframework.stereotype.Component;

import com.ella.forecasting.entities.Forecast;
import com.ella.forecasting.enums.ForecastStatus;

import lombok.RequiredArgsConstructor;

/**
 * Moves an active forecast to {@code EXPIRED} once its window has ended. Called when a forecast is
 * read and before it is saved.
 */
@Component
@RequiredArgsConstructor
public class ForecastExpiryPolicy {

    private final Clock clock;

    public boolean refresh(Forecast forecast) {
        return refresh(forecast, LocalDate.now(clock));
    }

    /**
     * @return true when the status changed
     */
    public boolean refresh(Forecast forecast, LocalDate today) {
        if (forecast.getStatus() == ForecastStatus.ACTIVE && forecast.isExpiredOn(today)) {
            forecast.setStatus(ForecastStatus.EXPIRED);
            return true;
        }
        return false;
    }
}
