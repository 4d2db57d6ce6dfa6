package org.pricewatch.errors;

import java.time.Duration;

// Job was still running when the deadline passed. The engine side job is left alone.
public class JobTimeoutException extends PriceQueryException {

    public JobTimeoutException(Duration timeout) {
        super("Query timed out after " + timeout.toMillis() + " ms");
    }
}
