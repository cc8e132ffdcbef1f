package com.ella.forecasting.services.forecasting.sources;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.ella.forecasting.entities.Budget;
import com.ella.forecasting.exceptions.UpstreamDataException;
import com.ella.forecasting.repositories.BudgetRepository;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class RepositoryBudgetSource implements BudgetSource {

    private final BudgetRepository budgetRepository;

    @Override
    public Optional<BigDecimal> fetchActiveBudget(UUID userId, String category) {
        try {
            Optional<Budget> budget = (category == null || category.isBlank())
                    ? budgetRepository.findFirstByOwnerIdAndCategoryIsNullAndActiveTrueOrderByCreatedAtDesc(userId)
                    : budgetRepository.findFirstByOwnerIdAndCategoryIgnoreCaseAndActiveTrueOrderByCreatedAtDesc(userId, category.trim());
            return budget.map(Budget::getAmount);
        } catch (DataAccessException e) {
            throw new UpstreamDataException("Budget lookup failed", e);
        }
    }
}
