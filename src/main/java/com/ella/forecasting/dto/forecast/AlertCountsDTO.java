package com.ella.forecasting.dto.forecast;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertCountsDTO {

    private int critical;
    private int high;
    private int medium;
    private int low;
    private int totalUnacknowledged;
}
