package com.ella.forecasting.services.forecasting;

import java.time.LocalDate;

/**
 * Total spending of one calendar month; {@code date} is the first day of that month.
 */
public record HistoricalPoint(LocalDate date, double amount) {
}
