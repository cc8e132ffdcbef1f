package com.ella.forecasting.services.forecasting.sources;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface TransactionHistorySource {

    /**
     * Spending records of the user between {@code start} and {@code end}, both inclusive.
     * A null category means every category.
     */
    List<SpendingRecord> fetchTransactions(UUID userId, String category, LocalDate start, LocalDate end);
}
