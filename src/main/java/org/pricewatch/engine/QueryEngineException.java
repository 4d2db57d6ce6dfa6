package org.pricewatch.engine;

// Engine call failed at the transport or API level
public class QueryEngineException extends RuntimeException {

    public QueryEngineException(String message) {
        super(message);
    }

    public QueryEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
