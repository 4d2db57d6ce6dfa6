package org.pricewatch.engine;

import java.util.Locale;

// Lifecycle of a query job as reported by the remote engine
public enum JobState {
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED,
    UNKNOWN;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    // QUEUED is accepted but not started, so still RUNNING; unrecognized strings are UNKNOWN
    public static JobState fromEngine(String raw) {
        if (raw == null) return UNKNOWN;

        switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "QUEUED":
            case "RUNNING":
                return RUNNING;
            case "SUCCEEDED":
                return SUCCEEDED;
            case "FAILED":
                return FAILED;
            case "CANCELLED":
                return CANCELLED;
            default:
                return UNKNOWN;
        }
    }
}
