package org.pricewatch.service;

import org.pricewatch.dto.PriceRow;
import org.pricewatch.engine.QueryEngine;
import org.pricewatch.engine.QueryEngineException;
import org.pricewatch.errors.FetchException;
import org.pricewatch.errors.SubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class PriceQueryService {
    private static final Logger LOG = LoggerFactory.getLogger(PriceQueryService.class);

    private final QueryEngine engine;
    private final RangeValidator rangeValidator;
    private final PriceQueryBuilder queryBuilder;
    private final JobPoller poller;
    private final ResultMapper mapper;

    private final String database;
    private final String outputLocation;

    public PriceQueryService(
            QueryEngine engine,
            RangeValidator rangeValidator,
            PriceQueryBuilder queryBuilder,
            JobPoller poller,
            ResultMapper mapper,
            String database,
            String outputLocation
    ) {
        this.engine = engine;
        this.rangeValidator = rangeValidator;
        this.queryBuilder = queryBuilder;
        this.poller = poller;
        this.mapper = mapper;
        this.database = database;
        this.outputLocation = outputLocation;
    }

    // Runs one query end to end. Any failure is a PriceQueryException; no partial results.
    public List<PriceRow> dailyPrices(String rawDays) {
        long started = System.currentTimeMillis();

        int days = rangeValidator.resolveDays(rawDays);
        String sql = queryBuilder.build(days);

        QueryJob job = submit(sql);
        LOG.info("Submitted price query jobId={} days={}", job.getJobId(), days);

        poller.awaitCompletion(job);

        List<PriceRow> rows = mapper.map(fetch(job));
        LOG.info("Price query done jobId={} rows={} elapsedMs={}",
                job.getJobId(), rows.size(), System.currentTimeMillis() - started);
        return rows;
    }

    // Single attempt, no retry
    QueryJob submit(String sql) {
        String jobId;
        try {
            jobId = engine.submitQuery(sql, database, outputLocation);
        } catch (QueryEngineException e) {
            throw new SubmissionException("Query submission failed: " + e.getMessage(), e);
        }

        if (jobId == null || jobId.trim().isEmpty()) {
            throw new SubmissionException("No query execution id returned from engine");
        }
        return new QueryJob(sql, jobId.trim());
    }

    private List<List<String>> fetch(QueryJob job) {
        try {
            return engine.getResults(job.getJobId());
        } catch (QueryEngineException e) {
            throw new FetchException("Fetching results failed for job " + job.getJobId() + ": " + e.getMessage(), e);
        }
    }
}
