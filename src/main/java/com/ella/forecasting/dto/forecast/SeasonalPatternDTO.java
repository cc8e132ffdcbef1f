package com.ella.forecasting.dto.forecast;

import java.time.LocalDate;
import java.util.List;

import com.ella.forecasting.entities.SeasonalFactor;

public record SeasonalPatternDTO(
        String category,
        LocalDate historicalStart,
        LocalDate historicalEnd,
        int monthsAnalyzed,
        List<SeasonalFactor> seasonalFactors
) {
}
