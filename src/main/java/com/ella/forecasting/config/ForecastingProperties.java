package com.ella.forecasting.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ella.forecasting")
public record ForecastingProperties(
        int minHistoryPoints,
        double confidenceZScore,
        int movingAverageWindow,
        double smoothingAlpha,
        int accuracyWindow,
        int defaultConfidenceLevel,
        Scheduler scheduler
) {
    public ForecastingProperties {
        if (minHistoryPoints <= 0) {
            minHistoryPoints = 3;
        }
        if (confidenceZScore <= 0) {
            confidenceZScore = 1.96;
        }
        if (movingAverageWindow <= 0) {
            movingAverageWindow = 3;
        }
        if (smoothingAlpha <= 0 || smoothingAlpha >= 1) {
            smoothingAlpha = 0.3;
        }
        if (accuracyWindow <= 0) {
            accuracyWindow = 10;
        }
        if (defaultConfidenceLevel <= 0) {
            defaultConfidenceLevel = 95;
        }
        if (scheduler == null) {
            scheduler = new Scheduler(false, 3, 90);
        }
    }

    public static ForecastingProperties defaults() {
        return new ForecastingProperties(0, 0, 0, 0, 0, 0, null);
    }

    /**
     * Daily jobs: forecast generation for recently active users and accuracy tracking.
     */
    public record Scheduler(
            boolean enabled,
            int topCategories,
            int activityLookbackDays
    ) {
        public Scheduler {
            if (topCategories <= 0) {
                topCategories = 3;
            }
            if (activityLookbackDays <= 0) {
                activityLookbackDays = 90;
            }
        }
    }
}
