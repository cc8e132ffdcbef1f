package com.ella.forecasting.repositories;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.ella.forecasting.entities.Budget;

@Repository
public interface BudgetRepository extends JpaRepository<Budget, UUID> {

    Optional<Budget> findFirstByOwnerIdAndCategoryIgnoreCaseAndActiveTrueOrderByCreatedAtDesc(UUID ownerId, String category);

    Optional<Budget> findFirstByOwnerIdAndCategoryIsNullAndActiveTrueOrderByCreatedAtDesc(UUID ownerId);
}
