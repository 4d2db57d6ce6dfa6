package org.pricewatch.errors;

import org.pricewatch.engine.JobState;

// Job reached FAILED, CANCELLED or UNKNOWN
public class JobFailedException extends PriceQueryException {
    private final String jobId;
    private final JobState state;
    private final String reason;

    public JobFailedException(String jobId, JobState state, String reason) {
        this(jobId, state, reason, null);
    }

    public JobFailedException(String jobId, JobState state, String reason, Throwable cause) {
        super(describe(state, reason), cause);
        this.jobId = jobId;
        this.state = state;
        this.reason = reason;
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getState() {
        return state;
    }

    public String getReason() {
        return reason;
    }

    private static String describe(JobState state, String reason) {
        String r = (reason == null || reason.isEmpty()) ? "" : ": " + reason;
        return "Query failed: " + state + r;
    }
}
