package com.egressoptimizer.ingestion;

/**
 * Raised when a metrics collection document cannot be read.
 */
public class MetricCollectionException extends RuntimeException {

    public MetricCollectionException(String message) {
        super(message);
    }

    public MetricCollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
