package org.pricewatch.engine;

// Result of a single status check: state plus the engine's reason, if it gave one
public class JobStatus {
    private final JobState state;
    private final String reason;

    public JobStatus(JobState state, String reason) {
        this.state = (state == null) ? JobState.UNKNOWN : state;
        this.reason = (reason == null || reason.trim().isEmpty()) ? null : reason.trim();
    }

    public static JobStatus of(JobState state) {
        return new JobStatus(state, null);
    }

    public JobState getState() {
        return state;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return (reason == null) ? state.name() : state.name() + ": " + reason;
    }
}
