package io.reloop.server.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/// Maps Bean Validation failures on request bodies and path parameters to 400.
///
/// The `error` line joins every violation so clients that only read `error` still
/// see all of them. `violations` lists them per field, sorted by field name.
///
/// ```json
/// {"error": "maxIterations: must be greater than or equal to 1; taskId: must not be blank",
///  "status": 400,
///  "violations": [{"field": "maxIterations", "message": "must be greater than or equal to 1"},
///                 {"field": "taskId", "message": "must not be blank"}]}
/// ```
@Provider
public class ConstraintViolationExceptionMapper
        implements ExceptionMapper<ConstraintViolationException> {

    private static final Logger LOG = Logger.getLogger(ConstraintViolationExceptionMapper.class);

    @Override
    public Response toResponse(ConstraintViolationException exception) {
        List<Map<String, String>> violations =
                exception.getConstraintViolations().stream()
                        .map(v -> Map.of("field", leafName(v), "message", v.getMessage()))
                        .sorted(
                                Comparator.comparing((Map<String, String> v) -> v.get("field"))
                                        .thenComparing(v -> v.get("message")))
                        .toList();
        String summary =
                violations.stream()
                        .map(v -> v.get("field") + ": " + v.get("message"))
                        .collect(Collectors.joining("; "));

        LOG.debugv("Rejected request body: {0}", LogSanitizer.sanitize(summary));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", summary);
        body.put("status", 400);
        body.put("violations", violations);
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(body)
                .build();
    }

    /// Last node of the property path, e.g. `taskId` for `start.request.taskId`.
    static String leafName(ConstraintViolation<?> violation) {
        String name = null;
        for (Path.Node node : violation.getPropertyPath()) {
            name = node.getName();
        }
        return name != null ? name : "unknown";
    }
}
