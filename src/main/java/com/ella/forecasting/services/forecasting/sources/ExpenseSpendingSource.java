package com.ella.forecasting.services.forecasting.sources;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.ella.forecasting.entities.Expense;
import com.ella.forecasting.exceptions.UpstreamDataException;
import com.ella.forecasting.repositories.ExpenseRepository;

import lombok.RequiredArgsConstructor;

/**
 * Reads spending from the local {@code expenses} table.
 */
@Component
@RequiredArgsConstructor
public class ExpenseSpendingSource implements TransactionHistorySource, ActualSpendingSource {

    private final ExpenseRepository expenseRepository;

    @Override
    public List<SpendingRecord> fetchTransactions(UUID userId, String category, LocalDate start, LocalDate end) {
        return loadExpenses(userId, category, start, end).stream()
                .filter(Objects::nonNull)
                .filter(e -> e.getTransactionDate() != null && e.getAmount() != null)
                .map(e -> new SpendingRecord(e.getTransactionDate(), e.getAmount()))
                .toList();
    }

    @Override
    public Optional<BigDecimal> fetchActualSpending(UUID userId, String category, LocalDate monthStart, LocalDate monthEnd) {
        List<Expense> expenses = loadExpenses(userId, category, monthStart, monthEnd);
        if (expenses.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal total = expenses.stream()
                .map(Expense::getAmount)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return Optional.of(total);
    }

    private List<Expense> loadExpenses(UUID userId, String category, LocalDate start, LocalDate end) {
        try {
            if (category == null || category.isBlank()) {
                return expenseRepository.findByOwnerIdAndTransactionDateBetweenOrderByTransactionDateAsc(userId, start, end);
            }
            return expenseRepository.findByOwnerIdAndCategoryIgnoreCaseAndTransactionDateBetweenOrderByTransactionDateAsc(
                    userId, category.trim(), start, end);
        } catch (DataAccessException e) {
            throw new UpstreamDataException("Expense history unavailable", e);
        }
    }
}
