package com.ella.forecasting.services.forecasting.sources;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

public interface ActualSpendingSource {

    /**
     * Realized spending for the month, empty while nothing has been recorded for it.
     */
    Optional<BigDecimal> fetchActualSpending(UUID userId, String category, LocalDate monthStart, LocalDate monthEnd);
}
