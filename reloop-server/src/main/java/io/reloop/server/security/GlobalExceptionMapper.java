package io.reloop.server.security;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Last-resort mapper for anything the iteration and validation mappers do not claim.
///
/// JAX-RS errors keep their status. Client-facing text is only passed through for
/// 400 and 409, where the message describes the caller's own request; other
/// statuses get a fixed phrase. Unexpected failures become a 500 and are logged
/// with their stack trace.
///
/// ```json
/// {"error": "Resource not found", "status": 404}
/// ```
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    private static final Map<Integer, String> FIXED_MESSAGES =
            Map.of(
                    404, "Resource not found",
                    405, "Method not allowed",
                    406, "Not acceptable",
                    415, "Unsupported media type");

    @Override
    public Response toResponse(Throwable exception) {
        if (!(exception instanceof WebApplicationException wae)) {
            LOG.errorv(exception, "Unhandled exception: {0}", exception.getMessage());
            return error(500, "Internal server error");
        }

        int status = wae.getResponse().getStatus();
        String message = clientMessage(status, wae.getMessage());
        if (status >= 500) {
            LOG.errorv(exception, "Request failed with {0}", status);
        } else {
            LOG.debugv("Rejected request with {0}: {1}", status, message);
        }
        return error(status, message);
    }

    private static String clientMessage(int status, String raw) {
        if (status >= 500) {
            return "Internal server error";
        }
        String fixed = FIXED_MESSAGES.get(status);
        if (fixed != null) {
            return fixed;
        }
        return raw != null ? raw : "Request failed";
    }

    private static Response error(int status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message, "status", status))
                .build();
    }
}
