package org.pricewatch;

import io.dropwizard.Application;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.setup.Bootstrap;
import io.dropwizard.setup.Environment;
import org.pricewatch.engine.AthenaQueryEngine;
import org.pricewatch.engine.QueryEngine;
import org.pricewatch.errors.GlobalExceptionMapper;
import org.pricewatch.resources.CorsFilter;
import org.pricewatch.resources.PriceResource;
import org.pricewatch.service.JobPoller;
import org.pricewatch.service.PriceQueryBuilder;
import org.pricewatch.service.PriceQueryService;
import org.pricewatch.service.RangeValidator;
import org.pricewatch.service.ResultMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.athena.AthenaClient;
import software.amazon.awssdk.services.athena.AthenaClientBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;

public class PricewatchApplication extends Application<PricewatchConfiguration> {
    private static final Logger LOG = LoggerFactory.getLogger(PricewatchApplication.class);

    @Override
    public String getName() {
        return "pricewatch";
    }

    @Override
    public void initialize(Bootstrap<PricewatchConfiguration> bootstrap) {
        // ATHENA_DATABASE, ATHENA_OUTPUT_S3 etc. are read from the environment
        bootstrap.setConfigurationSourceProvider(new SubstitutingSourceProvider(
                bootstrap.getConfigurationSourceProvider(),
                new EnvironmentVariableSubstitutor(true)));
    }

    @Override
    public void run(PricewatchConfiguration cfg, Environment env) {
        require(cfg.athenaDatabase, "athenaDatabase");
        require(cfg.athenaOutputLocation, "athenaOutputLocation");

        QueryEngine engine = createQueryEngine(cfg, env);

        JobPoller poller = new JobPoller(
                engine,
                Duration.ofMillis(cfg.pollIntervalMs),
                Duration.ofMillis(cfg.pollTimeoutMs),
                cfg.statusCheckRetries
        );
        ResultMapper mapper = new ResultMapper(env.metrics().meter("pricewatch.malformed-cells"));

        PriceQueryService service = new PriceQueryService(
                engine,
                new RangeValidator(),
                new PriceQueryBuilder(cfg.tableName),
                poller,
                mapper,
                cfg.athenaDatabase,
                cfg.athenaOutputLocation
        );

        ExecutorService workers = env.lifecycle()
                .executorService("price-query-%d")
                .minThreads(cfg.requestWorkerCount)
                .maxThreads(cfg.requestWorkerCount)
                .workQueue(new ArrayBlockingQueue<>(cfg.queueSize))
                .build();

        env.jersey().register(new GlobalExceptionMapper());
        env.jersey().register(new CorsFilter(cfg.corsMaxAgeSeconds));

        env.jersey().register(new PriceResource(
                service,
                workers,
                Duration.ofMillis(cfg.pollTimeoutMs + cfg.responseGraceMs)));

        LOG.info("Serving {} from database={} output={}", cfg.tableName, cfg.athenaDatabase, cfg.athenaOutputLocation);
    }

    // Builds the one long-lived engine client for this process
    protected QueryEngine createQueryEngine(PricewatchConfiguration cfg, Environment env) {
        AthenaClientBuilder builder = AthenaClient.builder().region(Region.of(cfg.awsRegion));
        if (cfg.athenaEndpoint != null && !cfg.athenaEndpoint.trim().isEmpty()) {
            builder.endpointOverride(URI.create(cfg.athenaEndpoint.trim()));
        }

        AthenaQueryEngine engine = new AthenaQueryEngine(builder.build(), cfg.athenaWorkGroup);
        env.lifecycle().manage(engine);
        return engine;
    }

    private static void require(String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalStateException(name + " must be configured");
        }
    }

    public static void main(String[] args) throws Exception {
        new PricewatchApplication().run(args);
    }
}
