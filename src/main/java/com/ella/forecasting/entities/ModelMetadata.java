package com.ella.forecasting.entities;

import java.time.LocalDateTime;

import com.ella.forecasting.enums.ForecastAlgorithm;

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
public class ModelMetadata {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ForecastAlgorithm algorithm;

    // 0..100; recalculado apenas pelo ForecastAccuracyRecorder
    @Column(name = "accuracy_score", nullable = false)
    private double accuracyScore;

    @Column(nullable = false)
    private double rmse;

    @Column(nullable = false)
    private double mae;

    @Column(name = "training_data_points", nullable = false)
    private int trainingDataPoints;

    @Column(name = "last_trained", nullable = false)
    private LocalDateTime lastTrained;
}
