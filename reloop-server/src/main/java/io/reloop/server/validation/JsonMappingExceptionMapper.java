package io.reloop.server.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Maps malformed request bodies to 400.
///
/// Covers syntax errors as well as rule definitions the rule deserializer rejects,
/// such as an unknown `type` or a missing required field. Only Jackson's original
/// message is returned; source locations are dropped.
///
/// @implNote Thread-safe. Stateless.
@Provider
public class JsonMappingExceptionMapper implements ExceptionMapper<JsonProcessingException> {

    private static final Logger LOG = Logger.getLogger(JsonMappingExceptionMapper.class);

    @Override
    public Response toResponse(JsonProcessingException exception) {
        String message =
                exception.getOriginalMessage() != null
                        ? exception.getOriginalMessage()
                        : "Malformed JSON request body";

        LOG.debugv("Rejected request body: {0}", LogSanitizer.sanitize(message));

        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message, "status", 400))
                .build();
    }
}
