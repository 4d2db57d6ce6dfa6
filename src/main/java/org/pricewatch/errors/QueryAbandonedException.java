package org.pricewatch.errors;

// Request was cancelled while waiting on the engine
public class QueryAbandonedException extends PriceQueryException {

    public QueryAbandonedException(String jobId, Throwable cause) {
        super("Query abandoned while waiting for job " + jobId, cause);
    }
}
