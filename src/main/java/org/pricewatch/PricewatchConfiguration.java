package org.pricewatch;

import io.dropwizard.Configuration;

public class PricewatchConfiguration extends Configuration {
    public String athenaDatabase;
    public String athenaOutputLocation;
    public String athenaWorkGroup;

    public String awsRegion = "us-east-1";
    // Optional endpoint override, e.g. a local Athena-compatible gateway
    public String athenaEndpoint;

    public String tableName = "crypto_bitcoin_daily";

    public long pollIntervalMs = 500;
    public long pollTimeoutMs = 60_000;
    public int statusCheckRetries = 2;

    public int requestWorkerCount = 8;
    // Requests waiting for a free worker; beyond this they get "server busy"
    public int queueSize = 100;
    public long responseGraceMs = 5_000;

    public int corsMaxAgeSeconds = 600;
}
