package com.ella.forecasting.dto.forecast;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastRequest {

    // weekly | monthly | quarterly | yearly; default monthly
    private String periodType;

    @Size(max = 100, message = "Category must have at most 100 characters")
    private String category;

    // moving_average | linear_regression | exponential_smoothing; default moving_average
    private String algorithm;

    @Min(value = 80, message = "Confidence level must be between 80 and 99")
    @Max(value = 99, message = "Confidence level must be between 80 and 99")
    private Integer confidenceLevel;
}
