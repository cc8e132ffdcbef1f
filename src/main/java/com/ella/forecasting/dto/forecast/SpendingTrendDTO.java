package com.ella.forecasting.dto.forecast;

import com.ella.forecasting.enums.ForecastTrend;
import com.ella.forecasting.enums.PeriodType;

public record SpendingTrendDTO(
        String category,
        ForecastTrend trend,
        double trendPercentage,
        PeriodType period
) {
}
