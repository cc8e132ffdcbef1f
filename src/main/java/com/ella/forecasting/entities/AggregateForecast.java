package com.ella.forecasting.entities;

import com.ella.forecasting.enums.ForecastTrend;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AggregateForecast {

    @Column(name = "total_predicted", nullable = false)
    private double totalPredicted;

    @Column(name = "average_monthly", nullable = false)
    private double averageMonthly;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ForecastTrend trend;

    @Column(name = "trend_percentage", nullable = false)
    private double trendPercentage;
}
