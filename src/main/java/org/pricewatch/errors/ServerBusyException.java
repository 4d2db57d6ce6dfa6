package org.pricewatch.errors;

// Every worker is busy and the wait queue is full
public class ServerBusyException extends PriceQueryException {

    public ServerBusyException(Throwable cause) {
        super("server busy", cause);
    }
}
