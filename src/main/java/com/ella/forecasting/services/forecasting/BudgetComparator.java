package com.ella.forecasting.services.forecasting;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.ella.forecasting.entities.BudgetComparison;
import com.ella.forecasting.services.forecasting.sources.BudgetSource;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class BudgetComparator {

    private final BudgetSource budgetSource;

    public BudgetComparison compare(UUID userId, String category, double totalPredicted) {
        Optional<BigDecimal> budget = budgetSource.fetchActiveBudget(userId, category);
        if (budget.isEmpty()) {
            return BudgetComparison.noBudget();
        }

        double budgetAmount = budget.get().doubleValue();
        double forecastVsBudget = totalPredicted - budgetAmount;
        return BudgetComparison.builder()
                .budgetAmount(budgetAmount)
                .forecastVsBudget(forecastVsBudget)
                .willExceed(forecastVsBudget > 0)
                .build();
    }
}
