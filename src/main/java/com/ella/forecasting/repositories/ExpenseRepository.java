package com.ella.forecasting.repositories;

import com.ella.forecasting.entities.Expense;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface ExpenseRepository extends JpaRepository<Expense, UUID> {

    // Buscar despesas por período
    List<Expense> findByOwnerIdAndTransactionDateBetweenOrderByTransactionDateAsc(
            UUID ownerId,
            LocalDate start,
            LocalDate end
    );

    // Buscar despesas por período e categoria
    List<Expense> findByOwnerIdAndCategoryIgnoreCaseAndTransactionDateBetweenOrderByTransactionDateAsc(
            UUID ownerId,
            String category,
            LocalDate start,
            LocalDate end
    );

    @Query("SELECT DISTINCT e.ownerId FROM Expense e WHERE e.transactionDate >= :since")
    List<UUID> findOwnerIdsWithExpensesSince(@Param("since") LocalDate since);

    @Query("SELECT e.category FROM Expense e WHERE e.ownerId = :ownerId AND e.transactionDate >= :since "
            + "GROUP BY e.category ORDER BY SUM(e.amount) DESC")
    List<String> findTopCategoriesSince(
            @Param("ownerId") UUID ownerId,
            @Param("since") LocalDate since,
            Pageable pageable
    );
}
