package com.ella.forecasting.exceptions;

/**
 * Request is well formed but the domain rules cannot be satisfied with the data available.
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
