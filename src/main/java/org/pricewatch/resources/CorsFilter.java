package org.pricewatch.resources;

import javax.ws.rs.HttpMethod;
import javax.ws.rs.container.ContainerRequestContext;
import javax.ws.rs.container.ContainerRequestFilter;
import javax.ws.rs.container.ContainerResponseContext;
import javax.ws.rs.container.ContainerResponseFilter;
import javax.ws.rs.container.PreMatching;
import javax.ws.rs.core.MultivaluedMap;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.Provider;

// Open CORS: any origin may read responses, preflights are answered here
@Provider
@PreMatching
public class CorsFilter implements ContainerRequestFilter, ContainerResponseFilter {
    static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
    static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";
    static final String MAX_AGE = "Access-Control-Max-Age";

    private final int maxAgeSeconds;

    public CorsFilter(int maxAgeSeconds) {
        this.maxAgeSeconds = maxAgeSeconds;
    }

    @Override
    public void filter(ContainerRequestContext ctx) {
        if (!HttpMethod.OPTIONS.equals(ctx.getMethod())) {
            return;
        }

        ctx.abortWith(Response.noContent()
                .header(ALLOW_ORIGIN, "*")
                .header(ALLOW_METHODS, "GET, OPTIONS")
                .header(ALLOW_HEADERS, "Content-Type")
                .header(MAX_AGE, String.valueOf(maxAgeSeconds))
                .build());
    }

    @Override
    public void filter(ContainerRequestContext req, ContainerResponseContext resp) {
        MultivaluedMap<String, Object> headers = resp.getHeaders();
        headers.putSingle(ALLOW_ORIGIN, "*");
    }
}
