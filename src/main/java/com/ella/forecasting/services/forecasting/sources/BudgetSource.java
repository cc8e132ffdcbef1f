package com.ella.forecasting.services.forecasting.sources;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

public interface BudgetSource {

    Optional<BigDecimal> fetchActiveBudget(UUID userId, String category);
}
