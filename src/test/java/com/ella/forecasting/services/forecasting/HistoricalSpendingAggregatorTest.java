package com.ella.forecasting.services.forecasting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ella.forecasting.config.ForecastingProperties;
import com.ella.forecasting.exceptions.InsufficientHistoryException;
import com.ella.forecasting.services.forecasting.sources.SpendingRecord;
import com.ella.forecasting.services.forecasting.sources.TransactionHistorySource;

@ExtendWith(MockitoExtension.class)
class HistoricalSpendingAggregatorTest {

    private static final LocalDate START = LocalDate.of(2023, 1, 1);
    private static final LocalDate END = LocalDate.of(2023, 12, 31);

    @Mock
    private TransactionHistorySource transactionHistorySource;

    private HistoricalSpendingAggregator aggregator;
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        aggregator = new HistoricalSpendingAggregator(transactionHistorySource, ForecastingProperties.defaults());
    }

    @Test
    void loadMonthlyHistory_groupsByMonthAscending() {
        when(transactionHistorySource.fetchTransactions(userId, "Food", START, END)).thenReturn(List.of(
                record(2023, 3, 10, "50.00"),
                record(2023, 1, 5, "100.00"),
                record(2023, 1, 20, "25.50"),
                record(2023, 2, 1, "80.00")
        ));

        List<HistoricalPoint> history = aggregator.loadMonthlyHistory(userId, "Food", START, END);

        assertEquals(3, history.size());
        assertEquals(LocalDate.of(2023, 1, 1), history.get(0).date());
        assertEquals(125.5, history.get(0).amount(), 1e-9);
        assertEquals(LocalDate.of(2023, 2, 1), history.get(1).date());
        assertEquals(LocalDate.of(2023, 3, 1), history.get(2).date());
        assertEquals(50.0, history.get(2).amount(), 1e-9);
    }

    @Test
    void loadMonthlyHistory_twoMonths_throwsInsufficientHistory() {
        when(transactionHistorySource.fetchTransactions(userId, null, START, END)).thenReturn(List.of(
                record(2023, 1, 5, "100.00"),
                record(2023, 1, 6, "10.00"),
                record(2023, 2, 5, "100.00")
        ));

        InsufficientHistoryException ex = assertThrows(InsufficientHistoryException.class,
                () -> aggregator.loadMonthlyHistory(userId, null, START, END));

        assertEquals(2, ex.getAvailablePoints());
        assertEquals(3, ex.getRequiredPoints());
    }

    @Test
    void loadMonthlyHistory_monthsWithoutSpending_areNotZeroFilled() {
        when(transactionHistorySource.fetchTransactions(userId, null, START, END)).thenReturn(List.of(
                record(2023, 1, 5, "100.00"),
                record(2023, 6, 5, "200.00"),
                record(2023, 11, 5, "300.00")
        ));

        List<HistoricalPoint> history = aggregator.loadMonthlyHistory(userId, null, START, END);

        assertEquals(List.of(
                new HistoricalPoint(LocalDate.of(2023, 1, 1), 100.0),
                new HistoricalPoint(LocalDate.of(2023, 6, 1), 200.0),
                new HistoricalPoint(LocalDate.of(2023, 11, 1), 300.0)
        ), history);
    }

    private static SpendingRecord record(int year, int month, int day, String amount) {
        return new SpendingRecord(LocalDate.of(year, month, day), new BigDecimal(amount));
    }
}
