package com.ella.forecasting.services.forecasting;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.ella.forecasting.config.ForecastingProperties;
import com.ella.forecasting.exceptions.InsufficientHistoryException;
import com.ella.forecasting.services.forecasting.sources.SpendingRecord;
import com.ella.forecasting.services.forecasting.sources.TransactionHistorySource;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class HistoricalSpendingAggregator {

    private final TransactionHistorySource transactionHistorySource;
    private final ForecastingProperties properties;

    /**
     * Monthly totals for the window, ascending by month. Only months with at least one record appear.
     *
     * @throws InsufficientHistoryException when fewer months than {@code minHistoryPoints} have data
     */
    public List<HistoricalPoint> loadMonthlyHistory(UUID userId, String category, LocalDate start, LocalDate end) {
        List<SpendingRecord> records = transactionHistorySource.fetchTransactions(userId, category, start, end);

        Map<YearMonth, BigDecimal> totals = new TreeMap<>();
        for (SpendingRecord record : records) {
            if (record == null || record.date() == null || record.amount() == null) continue;
            totals.merge(YearMonth.from(record.date()), record.amount(), BigDecimal::add);
        }

        List<HistoricalPoint> points = totals.entrySet().stream()
                .map(e -> new HistoricalPoint(e.getKey().atDay(1), e.getValue().doubleValue()))
                .toList();

        log.debug("[HistoricalSpendingAggregator] userId={} category={} range {} -> {} records={} months={}",
                userId, category, start, end, records.size(), points.size());

        if (points.size() < properties.minHistoryPoints()) {
            throw new InsufficientHistoryException(points.size(), properties.minHistoryPoints());
        }
        return points;
    }
}
