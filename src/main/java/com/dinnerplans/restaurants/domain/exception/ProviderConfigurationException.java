package com.dinnerplans.restaurants.domain.exception;

/**
 * Thrown at startup when the places provider is missing its credentials.
 */
public class ProviderConfigurationException extends RuntimeException {

    public ProviderConfigurationException(String message) {
        super(message);
    }
}
