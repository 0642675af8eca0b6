package io.reloop.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.junit.jupiter.api.Test;

class ConstraintViolationExceptionMapperTest {

    record StartForm(@NotBlank String taskId, @Min(1) int maxIterations, @ValidId String checkpointId) {}

    private final Validator validator =
            Validation.byDefaultProvider()
                    .configure()
                    .messageInterpolator(new ParameterMessageInterpolator())
                    .buildValidatorFactory()
                    .getValidator();
    private final ConstraintViolationExceptionMapper mapper =
            new ConstraintViolationExceptionMapper();

    @Test
    @SuppressWarnings("unchecked")
    void shouldListViolationsSortedByField() {
        var violations = validator.validate(new StartForm("", 0, "../x"));

        try (Response response = mapper.toResponse(new ConstraintViolationException(violations))) {
            assertThat(response.getStatus()).isEqualTo(400);
            Map<String, Object> body = (Map<String, Object>) response.getEntity();
            List<Map<String, String>> listed = (List<Map<String, String>>) body.get("violations");

            assertThat(listed)
                    .extracting(v -> v.get("field"))
                    .containsExactly("checkpointId", "maxIterations", "taskId");
            assertThat((String) body.get("error"))
                    .startsWith("checkpointId: must be a valid identifier")
                    .contains("; maxIterations: ")
                    .contains("; taskId: ");
        }
    }
}
