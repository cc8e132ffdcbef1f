package com.ella.forecasting.entities;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Point prediction for one month of the forecast window.
 *
 * Invariant: {@code confidenceLower <= predictedAmount <= confidenceUpper}.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Prediction {

    @Column(name = "prediction_date", nullable = false)
    private LocalDate date;

    @Column(name = "predicted_amount", nullable = false)
    private double predictedAmount;

    @Column(name = "confidence_lower", nullable = false)
    private double confidenceLower;

    @Column(name = "confidence_upper", nullable = false)
    private double confidenceUpper;

    @Column(name = "confidence_level", nullable = false)
    private int confidenceLevel;
}
