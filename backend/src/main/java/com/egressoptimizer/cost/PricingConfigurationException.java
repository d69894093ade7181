package com.egressoptimizer.cost;

/**
 * Raised when a pricing table or region map is malformed.
 * Thrown at construction time, never from the per-dataset analysis path.
 */
public class PricingConfigurationException extends RuntimeException {

    public PricingConfigurationException(String message) {
        super(message);
    }
}
