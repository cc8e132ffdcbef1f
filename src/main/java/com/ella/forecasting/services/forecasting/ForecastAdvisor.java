package com.ella.forecasting.services.forecasting;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.ella.forecasting.entities.AggregateForecast;
import com.ella.forecasting.entities.BudgetComparison;
import com.ella.forecasting.entities.ForecastAlert;
import com.ella.forecasting.entities.ForecastRecommendation;
import com.ella.forecasting.enums.AlertSeverity;
import com.ella.forecasting.enums.AlertType;
import com.ella.forecasting.enums.ForecastTrend;
import com.ella.forecasting.enums.RecommendationPriority;
import com.ella.forecasting.enums.RecommendationType;

/**
 * Rule-based recommendations and alerts over an already computed aggregate and budget comparison.
 */
@Component
public class ForecastAdvisor {

    private static final double REVIEW_CATEGORY_THRESHOLD = 15.0;
    private static final double UNUSUAL_SPIKE_THRESHOLD = 20.0;

    public List<ForecastRecommendation> recommend(AggregateForecast aggregate, BudgetComparison comparison) {
        List<ForecastRecommendation> recommendations = new ArrayList<>();

        if (comparison.isWillExceed()) {
            double exceededBy = comparison.getForecastVsBudget();
            recommendations.add(ForecastRecommendation.builder()
                    .recommendationType(RecommendationType.INCREASE_BUDGET)
                    .title("Budget Increase Recommended")
                    .description(String.format(Locale.US,
                            "Forecast indicates spending will exceed budget by $%.2f. Consider increasing budget or reducing spending.",
                            exceededBy))
                    .impactAmount(exceededBy)
                    .priority(RecommendationPriority.HIGH)
                    .build());
        }

        if (aggregate.getTrend() == ForecastTrend.INCREASING
                && aggregate.getTrendPercentage() > REVIEW_CATEGORY_THRESHOLD) {
            recommendations.add(ForecastRecommendation.builder()
                    .recommendationType(RecommendationType.REVIEW_CATEGORY)
                    .title("Rising Spending Trend Detected")
                    .description(String.format(Locale.US,
                            "Spending is projected to increase by %.1f%%. Review expenses to identify cost-saving opportunities.",
                            aggregate.getTrendPercentage()))
                    .impactAmount(null)
                    .priority(RecommendationPriority.MEDIUM)
                    .build());
        }

        if (aggregate.getTrend() == ForecastTrend.DECREASING && !comparison.isWillExceed()) {
            Double savings = comparison.hasBudget() ? Math.abs(comparison.getForecastVsBudget()) : null;
            String description = savings != null
                    ? String.format(Locale.US,
                            "Spending is decreasing. Consider allocating $%.2f to savings or investments.", savings)
                    : "Spending is decreasing. Consider allocating the difference to savings or investments.";
            recommendations.add(ForecastRecommendation.builder()
                    .recommendationType(RecommendationType.SAVE_MORE)
                    .title("Savings Opportunity")
                    .description(description)
                    .impactAmount(savings)
                    .priority(RecommendationPriority.LOW)
                    .build());
        }

        return recommendations;
    }

    public List<ForecastAlert> raiseAlerts(AggregateForecast aggregate, BudgetComparison comparison, LocalDateTime now) {
        List<ForecastAlert> alerts = new ArrayList<>();

        if (comparison.isWillExceed()) {
            alerts.add(newAlert(
                    AlertType.FORECAST_EXCEEDS_BUDGET,
                    AlertSeverity.HIGH,
                    String.format(Locale.US, "Your forecast indicates you will exceed your budget by $%.2f",
                            comparison.getForecastVsBudget()),
                    now));
        }

        if (aggregate.getTrend() == ForecastTrend.INCREASING
                && aggregate.getTrendPercentage() > UNUSUAL_SPIKE_THRESHOLD) {
            alerts.add(newAlert(
                    AlertType.UNUSUAL_SPIKE,
                    AlertSeverity.MEDIUM,
                    String.format(Locale.US, "Spending is projected to increase significantly by %.1f%%",
                            aggregate.getTrendPercentage()),
                    now));
        }

        return alerts;
    }

    private ForecastAlert newAlert(AlertType type, AlertSeverity severity, String message, LocalDateTime now) {
        return ForecastAlert.builder()
                .alertId(UUID.randomUUID())
                .alertType(type)
                .severity(severity)
                .message(message)
                .triggeredAt(now)
                .acknowledged(false)
                .build();
    }
}
