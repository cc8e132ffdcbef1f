package com.ella.forecasting.services.forecasting;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public final class ForecastTestData {

    private ForecastTestData() {
    }

    /**
     * Consecutive monthly points starting at {@code firstMonth}.
     */
    public static List<HistoricalPoint> monthly(LocalDate firstMonth, double... amounts) {
        List<HistoricalPoint> points = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            points.add(new HistoricalPoint(firstMonth.plusMonths(i).withDayOfMonth(1), amounts[i]));
        }
        return points;
    }
}
