package com.ella.forecasting.dto.forecast;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccuracyOverviewDTO {

    private Double overall;
    private Map<String, Double> byCategory;
}
