package org.pricewatch.errors;

// Base type for failures that end a price query request with a 500
public class PriceQueryException extends RuntimeException {

    public PriceQueryException(String message) {
        super(message);
    }

    public PriceQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
