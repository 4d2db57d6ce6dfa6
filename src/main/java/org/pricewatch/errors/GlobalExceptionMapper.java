package org.pricewatch.errors;

import org.pricewatch.dto.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;
// Single place where failures become HTTP responses
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {
    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable e) {
        if (e instanceof PriceQueryException) {
            LOG.error("Price query failed: {}", e.getMessage(), e.getCause());
            return json(500, safeMessage(e));
        }

        if (e instanceof WebApplicationException) {
            WebApplicationException we = (WebApplicationException) e;
            Response r = we.getResponse();
            int code = (r != null) ? r.getStatus() : 500;

            if (r != null && r.hasEntity()) return r;

            return json(code, messageCodeMapper(code));
        }
        // For unexpected errors
        LOG.error("Unhandled exception", e);
        return json(500, "internal error");
    }

    private static Response json(int code, String message) {
        return Response.status(code)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ApiError(message))
                .build();
    }
    // Maps HTTP status codes to error messages
    private static String messageCodeMapper(int code) {
        if (code == 404) return "URL not found";
        if (code == 405) return "method not allowed";
        if (code >= 400 && code < 500) return "bad request";
        return "internal error";
    }

    private static String safeMessage(Throwable e) {
        String m = e.getMessage();
        if (m == null || m.trim().isEmpty()) return "query failed";
        m = m.trim();
        return (m.length() > 300) ? m.substring(0, 300) : m;
    }
}
