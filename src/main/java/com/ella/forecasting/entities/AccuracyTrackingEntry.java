package com.ella.forecasting.entities;

import java.time.LocalDate;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
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
public class AccuracyTrackingEntry {

    @Column(name = "prediction_date", nullable = false)
    private LocalDate predictionDate;

    // Primeiro dia do mês da previsão; chave de idempotência junto com forecast_id
    @Column(name = "prediction_month", nullable = false)
    private LocalDate predictionMonth;

    @Column(name = "predicted_amount", nullable = false)
    private double predictedAmount;

    @Column(name = "actual_amount", nullable = false)
    private double actualAmount;

    @Column(name = "error_percentage", nullable = false)
    private double errorPercentage;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;
}
