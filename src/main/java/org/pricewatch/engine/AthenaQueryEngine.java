package org.pricewatch.engine;

import io.dropwizard.lifecycle.Managed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.athena.AthenaClient;
import software.amazon.awssdk.services.athena.model.Datum;
import software.amazon.awssdk.services.athena.model.GetQueryExecutionRequest;
import software.amazon.awssdk.services.athena.model.GetQueryExecutionResponse;
import software.amazon.awssdk.services.athena.model.GetQueryResultsRequest;
import software.amazon.awssdk.services.athena.model.GetQueryResultsResponse;
import software.amazon.awssdk.services.athena.model.QueryExecutionContext;
import software.amazon.awssdk.services.athena.model.QueryExecutionStatus;
import software.amazon.awssdk.services.athena.model.ResultConfiguration;
import software.amazon.awssdk.services.athena.model.Row;
import software.amazon.awssdk.services.athena.model.StartQueryExecutionRequest;
import software.amazon.awssdk.services.athena.model.StartQueryExecutionResponse;

import java.util.ArrayList;
import java.util.List;

// Amazon Athena backed query engine. One client is shared for the life of the process.
public class AthenaQueryEngine implements QueryEngine, Managed {
    private static final Logger LOG = LoggerFactory.getLogger(AthenaQueryEngine.class);

    private final AthenaClient client;
    private final String workGroup;

    public AthenaQueryEngine(AthenaClient client, String workGroup) {
        this.client = client;
        this.workGroup = (workGroup == null || workGroup.trim().isEmpty()) ? null : workGroup.trim();
    }

    @Override
    public String submitQuery(String queryText, String database, String outputLocation) {
        StartQueryExecutionRequest req = StartQueryExecutionRequest.builder()
                .queryString(queryText)
                .queryExecutionContext(QueryExecutionContext.builder().database(database).build())
                .resultConfiguration(ResultConfiguration.builder().outputLocation(outputLocation).build())
                .workGroup(workGroup)
                .build();

        try {
            StartQueryExecutionResponse resp = client.startQueryExecution(req);
            return resp.queryExecutionId();
        } catch (SdkException e) {
            throw new QueryEngineException("StartQueryExecution failed: " + e.getMessage(), e);
        }
    }

    @Override
    public JobStatus getJobStatus(String jobId) {
        GetQueryExecutionResponse resp;
        try {
            resp = client.getQueryExecution(GetQueryExecutionRequest.builder()
                    .queryExecutionId(jobId)
                    .build());
        } catch (SdkException e) {
            throw new QueryEngineException("GetQueryExecution failed: " + e.getMessage(), e);
        }

        QueryExecutionStatus status = (resp.queryExecution() == null) ? null : resp.queryExecution().status();
        if (status == null) return JobStatus.of(JobState.UNKNOWN);

        return new JobStatus(JobState.fromEngine(status.stateAsString()), status.stateChangeReason());
    }

    @Override
    public List<List<String>> getResults(String jobId) {
        List<List<String>> rows = new ArrayList<>();
        String token = null;
        int pages = 0;

        // Header row only appears on the first page
        do {
            GetQueryResultsResponse resp;
            try {
                resp = client.getQueryResults(GetQueryResultsRequest.builder()
                        .queryExecutionId(jobId)
                        .nextToken(token)
                        .build());
            } catch (SdkException e) {
                throw new QueryEngineException("GetQueryResults failed: " + e.getMessage(), e);
            }

            if (resp.resultSet() != null) {
                for (Row row : resp.resultSet().rows()) {
                    rows.add(cells(row));
                }
            }
            pages++;
            token = resp.nextToken();
        } while (token != null && !token.isEmpty());

        LOG.debug("Fetched results jobId={} rows={} pages={}", jobId, rows.size(), pages);
        return rows;
    }

    private static List<String> cells(Row row) {
        List<String> out = new ArrayList<>();
        for (Datum d : row.data()) {
            String v = (d == null) ? null : d.varCharValue();
            out.add(v == null ? "" : v);
        }
        return out;
    }

    @Override
    public void start() {
    }

    @Override
    public void stop() {
        client.close();
    }
}
