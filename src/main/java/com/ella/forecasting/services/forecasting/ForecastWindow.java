package com.ella.forecasting.services.forecasting;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public record ForecastWindow(
        LocalDate forecastStart,
        LocalDate forecastEnd,
        LocalDate historicalStart,
        LocalDate historicalEnd
) {

    /**
     * One date per month from {@code forecastStart}, strictly before {@code forecastEnd}.
     */
    public List<LocalDate> predictionDates() {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate current = forecastStart;
        int step = 0;
        while (current.isBefore(forecastEnd)) {
            dates.add(current);
            step++;
            current = forecastStart.plusMonths(step);
        }
        return dates;
    }
}
