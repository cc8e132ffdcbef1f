package com.ella.forecasting.exceptions;

/**
 * A spending or budget source failed. The message and cause of the source error are kept as-is.
 */
public class UpstreamDataException extends RuntimeException {

    public UpstreamDataException(String source, Throwable cause) {
        super(source + ": " + cause.getMessage(), cause);
    }
}
