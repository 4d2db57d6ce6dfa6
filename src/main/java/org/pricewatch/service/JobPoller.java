package org.pricewatch.service;

import org.pricewatch.engine.JobState;
import org.pricewatch.engine.JobStatus;
import org.pricewatch.engine.QueryEngine;
import org.pricewatch.engine.QueryEngineException;
import org.pricewatch.errors.JobFailedException;
import org.pricewatch.errors.JobTimeoutException;
import org.pricewatch.errors.QueryAbandonedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

// Blocks until the job is terminal, the deadline passes, or the thread is interrupted.
// The engine side job is never cancelled.
public class JobPoller {
    private static final Logger LOG = LoggerFactory.getLogger(JobPoller.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration d) throws InterruptedException;
    }

    private final QueryEngine engine;
    private final Duration pollInterval;
    private final Duration timeout;
    private final int statusCheckRetries;
    private final Clock clock;
    private final Sleeper sleeper;

    public JobPoller(QueryEngine engine, Duration pollInterval, Duration timeout, int statusCheckRetries) {
        this(engine, pollInterval, timeout, statusCheckRetries, Clock.systemUTC(), d -> Thread.sleep(d.toMillis()));
    }

    public JobPoller(QueryEngine engine,
                     Duration pollInterval,
                     Duration timeout,
                     int statusCheckRetries,
                     Clock clock,
                     Sleeper sleeper) {
        if (pollInterval.isNegative() || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("pollInterval must be >= 0 and timeout > 0");
        }
        this.engine = engine;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
        this.statusCheckRetries = Math.max(0, statusCheckRetries);
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public void awaitCompletion(QueryJob job) {
        Instant deadline = clock.instant().plus(timeout);
        int checks = 0;
        int consecutiveErrors = 0;

        while (true) {
            checks++;
            JobStatus status;
            try {
                status = engine.getJobStatus(job.getJobId());
                consecutiveErrors = 0;
            } catch (QueryEngineException e) {
                consecutiveErrors++;
                if (consecutiveErrors > statusCheckRetries) {
                    throw new JobFailedException(job.getJobId(), JobState.UNKNOWN,
                            "status check failed: " + e.getMessage(), e);
                }
                LOG.warn("Status check failed jobId={} attempt={}/{}: {}",
                        job.getJobId(), consecutiveErrors, statusCheckRetries, e.getMessage());
                status = null;
            }

            if (status != null) {
                job.update(status);
                LOG.debug("Poll jobId={} check={} state={}", job.getJobId(), checks, status);

                if (status.getState() == JobState.SUCCEEDED) {
                    LOG.debug("Job succeeded jobId={} after {} checks", job.getJobId(), checks);
                    return;
                }
                if (status.getState().isTerminal()) {
                    throw new JobFailedException(job.getJobId(), status.getState(), status.getReason());
                }
            }

            if (!clock.instant().isBefore(deadline)) {
                throw new JobTimeoutException(timeout);
            }

            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new QueryAbandonedException(job.getJobId(), ie);
            }
        }
    }
}
