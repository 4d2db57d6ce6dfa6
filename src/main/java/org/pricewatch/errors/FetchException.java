package org.pricewatch.errors;

// Result retrieval failed after the job succeeded
public class FetchException extends PriceQueryException {

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
