package com.ella.forecasting.entities;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import com.ella.forecasting.enums.ForecastStatus;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "forecasts",
        indexes = {
                @Index(name = "idx_forecast_user_status", columnList = "user_id, status"),
                @Index(name = "idx_forecast_user_start_category", columnList = "user_id, start_date, category"),
                @Index(name = "idx_forecast_end_date", columnList = "end_date")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Forecast {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Embedded
    private ForecastPeriod forecastPeriod;

    @Column(length = 100)
    private String category;

    @ElementCollection
    @CollectionTable(name = "forecast_predictions", joinColumns = @JoinColumn(name = "forecast_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<Prediction> predictions = new ArrayList<>();

    @Embedded
    private AggregateForecast aggregateForecast;

    @ElementCollection
    @CollectionTable(name = "forecast_seasonal_factors", joinColumns = @JoinColumn(name = "forecast_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<SeasonalFactor> seasonalFactors = new ArrayList<>();

    @Embedded
    private ModelMetadata modelMetadata;

    @Embedded
    private BudgetComparison comparison;

    @ElementCollection
    @CollectionTable(name = "forecast_alerts", joinColumns = @JoinColumn(name = "forecast_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<ForecastAlert> alerts = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "forecast_recommendations", joinColumns = @JoinColumn(name = "forecast_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<ForecastRecommendation> recommendations = new ArrayList<>();

    @ElementCollection
    @CollectionTable(
            name = "forecast_accuracy_tracking",
            joinColumns = @JoinColumn(name = "forecast_id"),
            uniqueConstraints = @UniqueConstraint(
                    name = "uk_accuracy_forecast_month",
                    columnNames = {"forecast_id", "prediction_month"}
            )
    )
    @OrderColumn(name = "position")
    @Builder.Default
    private List<AccuracyTrackingEntry> accuracyTracking = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ForecastStatus status = ForecastStatus.ACTIVE;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public boolean isExpiredOn(LocalDate today) {
        return forecastPeriod != null && today.isAfter(forecastPeriod.getEndDate());
    }

    public long daysRemaining(LocalDate today) {
        if (forecastPeriod == null) {
            return 0;
        }
        return ChronoUnit.DAYS.between(today, forecastPeriod.getEndDate());
    }

    public boolean isTracked(YearMonth month) {
        return accuracyTracking.stream()
                .anyMatch(entry -> YearMonth.from(entry.getPredictionMonth()).equals(month));
    }

    /**
     * Mean accuracy over every tracked month, kept within 0..100, or {@code null} while nothing
     * has been tracked.
     */
    public Double getForecastAccuracy() {
        if (accuracyTracking.isEmpty()) {
            return null;
        }
        double totalError = accuracyTracking.stream()
                .mapToDouble(entry -> Math.abs(entry.getErrorPercentage()))
                .sum();
        double accuracy = 100 - (totalError / accuracyTracking.size());
        return Math.max(0.0, Math.min(100.0, accuracy));
    }

    public Optional<ForecastAlert> findAlert(UUID alertId) {
        return alerts.stream()
                .filter(alert -> alert.getAlertId().equals(alertId))
                .findFirst();
    }
}
