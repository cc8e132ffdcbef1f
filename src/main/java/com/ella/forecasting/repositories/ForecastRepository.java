package com.ella.forecasting.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.ella.forecasting.entities.Forecast;
import com.ella.forecasting.enums.ForecastStatus;

import jakarta.persistence.LockModeType;

@Repository
public interface ForecastRepository extends JpaRepository<Forecast, UUID> {

    Optional<Forecast> findByIdAndUserId(UUID id, UUID userId);

    List<Forecast> findByUserIdAndStatusOrderByForecastPeriodStartDateDesc(UUID userId, ForecastStatus status);

    // Forecasts cuja janela contém o dia informado
    @Query("SELECT f FROM Forecast f WHERE f.userId = :userId AND f.status = :status "
            + "AND f.forecastPeriod.startDate <= :day AND f.forecastPeriod.endDate >= :day")
    List<Forecast> findCurrentForecasts(
            @Param("userId") UUID userId,
            @Param("status") ForecastStatus status,
            @Param("day") LocalDate day
    );

    @Query("SELECT f.id FROM Forecast f WHERE f.userId = :userId AND f.status = :status")
    List<UUID> findIdsByUserIdAndStatus(@Param("userId") UUID userId, @Param("status") ForecastStatus status);

    @Query("SELECT DISTINCT f.userId FROM Forecast f WHERE f.status = :status")
    List<UUID> findDistinctUserIdsByStatus(@Param("status") ForecastStatus status);

    /**
     * Single writer per forecast while accuracy entries are appended.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM Forecast f WHERE f.id = :id")
    Optional<Forecast> findByIdForUpdate(@Param("id") UUID id);
}
