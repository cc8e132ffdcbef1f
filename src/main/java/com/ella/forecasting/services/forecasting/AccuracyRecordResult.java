package com.ella.forecasting.services.forecasting;

public record AccuracyRecordResult(int entriesRecorded, int monthsPending) {

    public static AccuracyRecordResult nothing() {
        return new AccuracyRecordResult(0, 0);
    }
}
