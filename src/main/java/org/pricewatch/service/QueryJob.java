package org.pricewatch.service;

import org.pricewatch.engine.JobState;
import org.pricewatch.engine.JobStatus;

// Per-request view of a submitted engine job. Only the poller updates state.
public class QueryJob {
    private final String queryText;
    private final String jobId;
    private volatile JobState state = JobState.RUNNING;
    private volatile String failureReason;

    public QueryJob(String queryText, String jobId) {
        this.queryText = queryText;
        this.jobId = jobId;
    }

    void update(JobStatus status) {
        this.state = status.getState();
        this.failureReason = status.getReason();
    }

    public String getQueryText() {
        return queryText;
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getState() {
        return state;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
