package com.ella.forecasting.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Forecast total against the user's active budget. Amounts are null when no budget exists.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BudgetComparison {

    @Column(name = "budget_amount")
    private Double budgetAmount;

    @Column(name = "forecast_vs_budget")
    private Double forecastVsBudget;

    @Column(name = "will_exceed", nullable = false)
    private boolean willExceed;

    public static BudgetComparison noBudget() {
        return new BudgetComparison(null, null, false);
    }

    public boolean hasBudget() {
        return budgetAmount != null;
    }
}
