package com.ella.forecasting.dto.forecast;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastSummaryDTO {

    private int totalForecasts;
    private double totalPredictedSpending;
    private List<CategoryForecastDTO> categories;
    private AlertCountsDTO alerts;
    private AccuracyOverviewDTO accuracy;
}
