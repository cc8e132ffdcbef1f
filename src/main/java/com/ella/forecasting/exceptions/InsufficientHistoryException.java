package com.ella.forecasting.exceptions;

import lombok.Getter;

@Getter
public class InsufficientHistoryException extends BusinessException {

    private final int availablePoints;
    private final int requiredPoints;

    public InsufficientHistoryException(int availablePoints, int requiredPoints) {
        super(String.format(
                "Insufficient historical data for forecasting (minimum %d periods required, found %d)",
                requiredPoints,
                availablePoints
        ));
        this.availablePoints = availablePoints;
        this.requiredPoints = requiredPoints;
    }
}
