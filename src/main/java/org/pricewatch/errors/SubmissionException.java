package org.pricewatch.errors;

// The engine rejected the query or did not hand back a job id
public class SubmissionException extends PriceQueryException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
