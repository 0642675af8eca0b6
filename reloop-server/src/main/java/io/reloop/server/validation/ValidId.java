package io.reloop.server.validation;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.TYPE_USE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/// Validates that a task or checkpoint id is safe to use in paths, SQL parameters
/// and log lines.
///
/// A valid id starts with an alphanumeric character, continues with alphanumerics,
/// dots, hyphens, underscores or colons, and is at most 255 characters long.
///
/// ```java
/// @POST
/// @Path("/{taskId}/validate")
/// public Response validate(@PathParam("taskId") @ValidId String taskId, ...) { ... }
/// ```
///
/// @see ValidIdValidator
@Target({FIELD, PARAMETER, TYPE_USE})
@Retention(RUNTIME)
@Constraint(validatedBy = ValidIdValidator.class)
@Documented
public @interface ValidId {

    String message() default
            "must be a valid identifier (alphanumeric, dots, hyphens, underscores, colons;"
                    + " 1-255 chars)";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
