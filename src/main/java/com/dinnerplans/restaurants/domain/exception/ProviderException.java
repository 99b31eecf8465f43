package com.dinnerplans.restaurants.domain.exception;

/**
 * Thrown when the places provider fails or reports a status other than OK or ZERO_RESULTS.
 */
public class ProviderException extends RuntimeException {

    private final String status;

    public ProviderException(String message, String status) {
        super(message);
        this.status = status;
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.status = null;
    }

    public String getStatus() {
        return status;
    }
}
