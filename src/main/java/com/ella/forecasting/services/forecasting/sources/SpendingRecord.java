package com.ella.forecasting.services.forecasting.sources;

import java.math.BigDecimal;
import java.time.LocalDate;

public record SpendingRecord(LocalDate date, BigDecimal amount) {
}
