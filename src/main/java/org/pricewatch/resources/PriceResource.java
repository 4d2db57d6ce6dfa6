package org.pricewatch.resources;

import org.pricewatch.dto.PriceResponse;
import org.pricewatch.errors.JobTimeoutException;
import org.pricewatch.errors.ServerBusyException;
import org.pricewatch.service.PriceQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.container.AsyncResponse;
import javax.ws.rs.container.Suspended;
import javax.ws.rs.core.MediaType;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

// GET /crypto?days=7|30|90
// Runs on a worker thread. The poll deadline ends the work even if the client has gone away,
// the response timeout interrupts a worker that outlives it.
@Path("/crypto")
@Produces(MediaType.APPLICATION_JSON)
public class PriceResource {
    private static final Logger LOG = LoggerFactory.getLogger(PriceResource.class);

    private final PriceQueryService service;
    private final ExecutorService workers;
    private final Duration responseTimeout;

    public PriceResource(PriceQueryService service, ExecutorService workers, Duration responseTimeout) {
        this.service = service;
        this.workers = workers;
        this.responseTimeout = responseTimeout;
    }

    @GET
    public void prices(@QueryParam("days") String days, @Suspended AsyncResponse response) {
        AtomicReference<Future<?>> task = new AtomicReference<>();

        response.setTimeout(responseTimeout.toMillis(), TimeUnit.MILLISECONDS);
        response.setTimeoutHandler(ar -> {
            LOG.warn("Response deadline of {} ms passed, interrupting worker", responseTimeout.toMillis());
            Future<?> running = task.get();
            if (running != null) running.cancel(true);
            ar.resume(new JobTimeoutException(responseTimeout));
        });

        try {
            task.set(workers.submit(() -> run(days, response)));
        } catch (RejectedExecutionException e) {
            LOG.warn("Worker pool rejected request days={}", days);
            response.resume(new ServerBusyException(e));
        }
    }

    private void run(String days, AsyncResponse response) {
        try {
            response.resume(new PriceResponse(service.dailyPrices(days)));
        } catch (Exception e) {
            response.resume(e);
        }
    }
}
