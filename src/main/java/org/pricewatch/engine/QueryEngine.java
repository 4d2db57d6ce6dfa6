package org.pricewatch.engine;

import java.util.List;

// Remote async query engine, shared by all requests. Calls throw QueryEngineException on transport/API errors.
public interface QueryEngine {

    // Returns the engine's job id, or null if none was returned
    String submitQuery(String queryText, String database, String outputLocation);

    JobStatus getJobStatus(String jobId);

    // All result rows as text cells, row 0 is the header
    List<List<String>> getResults(String jobId);
}
