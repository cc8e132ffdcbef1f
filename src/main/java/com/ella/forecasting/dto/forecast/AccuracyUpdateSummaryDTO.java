package com.ella.forecasting.dto.forecast;

public record AccuracyUpdateSummaryDTO(
        int forecastsChecked,
        int entriesRecorded,
        int monthsPending,
        String message
) {
}
