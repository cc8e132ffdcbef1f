package com.ella.forecasting.dto.forecast;

import com.ella.forecasting.enums.ForecastTrend;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryForecastDTO {

    private String category;
    private double predicted;
    private ForecastTrend trend;
    // null enquanto nenhum mês foi acompanhado
    private Double accuracy;
}
