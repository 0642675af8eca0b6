package io.reloop.server.api;

import io.reloop.core.exception.ChainClosedException;
import io.reloop.core.exception.DuplicateActiveSessionException;
import io.reloop.core.exception.IllegalIterationStateException;
import io.reloop.core.exception.InvalidIterationConfigException;
import io.reloop.core.exception.IterationException;
import io.reloop.core.exception.MaxIterationsExceededException;
import io.reloop.core.exception.SessionNotFoundException;
import io.reloop.core.exception.StaleChainException;
import io.reloop.core.exception.UnregisteredCustomValidatorException;
import io.reloop.server.validation.LogSanitizer;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Maps iteration contract violations to client error responses.
///
/// | Exception | Status |
/// |-----------|--------|
/// | `DuplicateActiveSessionException`, `StaleChainException`, `ChainClosedException`, `MaxIterationsExceededException`, `IllegalIterationStateException` | 409 |
/// | `SessionNotFoundException` | 404 |
/// | `InvalidIterationConfigException`, `UnregisteredCustomValidatorException` | 400 |
///
/// The exception message is safe to return: it names the task and the violated
/// contract, never internal state.
///
/// @implNote Thread-safe. Stateless.
@Provider
public class IterationExceptionMapper implements ExceptionMapper<IterationException> {

    private static final Logger LOG = Logger.getLogger(IterationExceptionMapper.class);

    @Override
    public Response toResponse(IterationException exception) {
        int status = statusOf(exception);

        LOG.debugv(
                "Iteration request rejected ({0}) for task {1}: {2}",
                status,
                LogSanitizer.sanitize(exception.getTaskId()),
                LogSanitizer.sanitize(exception.getMessage()));

        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", exception.getMessage(), "status", status))
                .build();
    }

    static int statusOf(IterationException exception) {
        if (exception instanceof SessionNotFoundException) {
            return 404;
        }
        if (exception instanceof InvalidIterationConfigException
                || exception instanceof UnregisteredCustomValidatorException) {
            return 400;
        }
        if (exception instanceof DuplicateActiveSessionException
                || exception instanceof StaleChainException
                || exception instanceof ChainClosedException
                || exception instanceof MaxIterationsExceededException
                || exception instanceof IllegalIterationStateException) {
            return 409;
        }
        return 500;
    }
}
